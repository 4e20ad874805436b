package com.tariffwise.dispatch.cli;

import com.tariffwise.core.model.CandidateClassification;
import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.FinalPayload;
import com.tariffwise.core.model.ProductLine;
import com.tariffwise.core.service.ClassificationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: tariffwise classify -d "&lt;description&gt;" [-d ...]
 * <p>
 * Classifies one or more product lines and prints the validated candidates, the cleaned
 * reply text and any issues. Origin, quantity and value apply to every line.
 */
@Command(name = "classify", mixinStandardHelpOptions = true, description = "Classify product descriptions")
@Component
public class ClassifyCommand implements Runnable {

    @Option(names = {"-d", "--description"}, required = true,
            description = "Product description (repeat for several lines)")
    private List<String> descriptions = new ArrayList<>();

    @Option(names = {"--subject", "-s"}, description = "Subject of the originating message (thread tracking)")
    private String subject;

    @Option(names = "--origin", description = "Declared country of origin")
    private String origin;

    @Option(names = "--quantity", description = "Declared quantity")
    private Integer quantity;

    @Option(names = "--value", description = "Declared value")
    private BigDecimal value;

    @Option(names = "--context", description = "Free-text context for the classifier")
    private String context;

    private final ClassificationService classificationService;

    public ClassifyCommand(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ProductLine> lines = new ArrayList<>();
        ClassificationRequest request;
        try {
            for (String description : descriptions) {
                lines.add(new ProductLine(description, quantity, origin, value));
            }
            request = new ClassificationRequest(null, subject, null, lines, context, null);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid input: " + e.getMessage());
            return;
        }

        ConsoleOutput.info("Classifying " + lines.size() + " line(s) as " + request.requestId() + "...");
        FinalPayload payload = classificationService.classify(request);

        System.out.println();
        for (CandidateClassification candidate : payload.candidates()) {
            ConsoleOutput.candidate(candidate);
        }
        if (!payload.cleanedText().isBlank()) {
            System.out.println();
            System.out.println(payload.cleanedText());
        }
        System.out.println();
        for (String issue : payload.blockingIssues()) {
            ConsoleOutput.error(issue);
        }
        for (String warning : payload.warnings()) {
            ConsoleOutput.warn(warning);
        }
        ConsoleOutput.status(payload);
    }
}
