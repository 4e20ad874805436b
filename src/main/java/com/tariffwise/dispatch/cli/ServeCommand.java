package com.tariffwise.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tariffwise serve
 * <p>
 * Starts the HTTP server. The web application type is switched on by
 * {@link com.tariffwise.TariffwiseApplication#main} when "serve" is present, and
 * {@link CliRunner} skips picocli in that case, so {@link #run()} only serves {@code --help}.
 * The banner is printed once the embedded server reports its port.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Tariffwise HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Tariffwise server running on port " + port);
        System.out.println();
        System.out.println("  Classify:  POST http://localhost:" + port + "/api/v1/classifications");
        System.out.println("  Health:    GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
    }
}
