package com.openavail.availability.cli;

import com.openavail.availability.document.DocumentFormat;
import com.openavail.availability.domain.service.AvailabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Processes one request document given on the command line and prints the response.
 * <pre>
 * java -jar availability-service.jar --request=avail-rq.xml [--format=xml|json]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityRequestRunner implements ApplicationRunner {

    static final String REQUEST_OPTION = "request";
    static final String FORMAT_OPTION = "format";

    private final AvailabilityService availabilityService;
    private PrintStream out = System.out;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String requestPath = singleOption(args, REQUEST_OPTION);
        if (requestPath == null) {
            log.info("No --{} given; usage: --{}=<file> [--{}=xml|json]",
                    REQUEST_OPTION, REQUEST_OPTION, FORMAT_OPTION);
            return;
        }
        String formatName = singleOption(args, FORMAT_OPTION);
        DocumentFormat format = formatName != null
                ? DocumentFormat.fromName(formatName)
                : DocumentFormat.fromFileName(requestPath);

        log.info("Processing {} availability request from {}", format, requestPath);
        String content = Files.readString(Path.of(requestPath), StandardCharsets.UTF_8);
        out.println(availabilityService.process(content, format));
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private static String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
