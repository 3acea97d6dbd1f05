package org.pgstudio.kernel;

import org.pgstudio.kernel.config.ConnectionProfilesProperties;
import org.pgstudio.kernel.config.KernelProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({KernelProperties.class, ConnectionProfilesProperties.class})
public class PgStudioKernelApplication {
    public static void main(String[] args) {
        SpringApplication.run(PgStudioKernelApplication.class, args);
    }
}
