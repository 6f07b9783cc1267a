package com.socmind;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. {@code socmind serve} starts the REST server; every other command runs
 * through picocli without a web server and exits with the command's exit code.
 */
@SpringBootApplication
public class SocmindApplication {

    public static void main(String[] args) {
        boolean serve = isServeCommand(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(SocmindApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * True when the subcommand, the first argument that is not an option, is {@code serve}.
     * An option value such as {@code --description serve} does not count.
     */
    public static boolean isServeCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }
}
