package com.reqflow;

import com.reqflow.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class ReqflowApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.servesHttp(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(ReqflowApplication.class);

        if (serveMode) {
            // Enable web server for REST API + SSE
            builder.properties("spring.main.web-application-type=servlet");
        } else {
            // CLI-only: no web server
            builder.properties("spring.main.web-application-type=none");
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }
}
