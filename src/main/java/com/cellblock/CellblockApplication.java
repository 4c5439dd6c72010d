package com.cellblock;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class CellblockApplication {

    public static void main(String[] args) {
        SpringApplicationBuilder builder = new SpringApplicationBuilder(CellblockApplication.class);

        // CLI-only: no web server
        builder.properties(
                "spring.main.web-application-type=none",
                "spring.main.banner-mode=off"
        );

        ApplicationContext ctx = builder.run(args);

        // exit after command execution, which also shuts down connected runtimes
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}
