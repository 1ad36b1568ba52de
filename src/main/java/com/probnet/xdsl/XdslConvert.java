package com.probnet.xdsl;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.probnet.xdsl.convert.ConversionOptions;
import com.probnet.xdsl.convert.XdslConverter;
import com.probnet.xdsl.graph.NetworkGraph;
import com.probnet.xdsl.io.MalformedDocumentException;
import com.probnet.xdsl.util.GraphExplain;
import com.probnet.xdsl.validate.ValidationReport;
import com.probnet.xdsl.validate.XdslValidationException;

/**
 * Command line pass-through around {@link XdslConverter}.
 *
 * <pre>
 * XdslConvert &lt;input.xdsl&gt; [output.py] [--check] [--explain] [--mermaid]
 *             [--no-comments] [--no-mau-weights]
 * </pre>
 *
 * Without an output path the script goes to stdout. {@code --check} prints
 * the JSON validation report and nothing else.
 */
public final class XdslConvert {
    private static final Logger log = LogManager.getLogger(XdslConvert.class);

    private XdslConvert() {
    }

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0)
            System.exit(status);
    }

    /** Runs the command and returns the process exit status. */
    static int run(String[] args, PrintStream out) {
        List<String> positional = new ArrayList<>();
        boolean check = false, explain = false, mermaid = false;
        ConversionOptions options = new ConversionOptions();
        for (String a : args) {
            switch (a) {
                case "--check" -> check = true;
                case "--explain" -> explain = true;
                case "--mermaid" -> mermaid = true;
                case "--no-comments" -> options.setIncludeComments(false);
                case "--no-mau-weights" -> options.setApplyMauWeights(false);
                default -> {
                    if (a.startsWith("--")) {
                        log.error("Unknown option {}", a);
                        return 2;
                    }
                    positional.add(a);
                }
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            log.error("Usage: XdslConvert <input.xdsl> [output] [--check] [--explain] [--mermaid] "
                    + "[--no-comments] [--no-mau-weights]");
            return 2;
        }

        Path input = Path.of(positional.get(0));
        XdslConverter converter = new XdslConverter(options);
        try {
            if (check) {
                ValidationReport report = converter.checkFile(input);
                out.println(report.toJson());
                return report.isEmpty() ? 0 : 1;
            }

            NetworkGraph graph = converter.parseFile(input);
            if (explain)
                log.info("\n{}", new GraphExplain(graph).dumpTopology());
            String artifact = mermaid ? new GraphExplain(graph).toMermaid() : converter.generateScript(graph);
            if (positional.size() == 2) {
                Files.writeString(Path.of(positional.get(1)), artifact, StandardCharsets.UTF_8);
                log.info("Wrote {} for {} to {}", mermaid ? "Mermaid diagram" : "pyAgrum script",
                        input.getFileName(), positional.get(1));
            } else {
                out.print(artifact);
            }
            return 0;
        } catch (MalformedDocumentException e) {
            log.error("{}: {}", input, e.getMessage());
            return 1;
        } catch (XdslValidationException e) {
            log.error("{} is not convertible:\n{}", input, e.getReport().summary());
            return 1;
        } catch (IOException e) {
            log.error("I/O failure on {}", input, e);
            return 1;
        }
    }
}
