package com.jdbg;

import com.jdbg.json.TraceRequest;
import com.jdbg.json.TraceRequestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "jdbg", mixinStandardHelpOptions = true, version = "1.0",
         description = "Trace the evaluation of a JSON-encoded expression step by step")
public class JDbg implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(JDbg.class);

    @Parameters(index = "0", arity = "0..1", description = "Trace request file (default: stdin)")
    private File inputFile;

    @Option(names = {"-C", "--color-output"}, description = "Colorize the trace")
    private boolean colorOutput = false;

    @Option(names = {"--no-location"}, description = "Do not print the call-site header")
    private boolean noLocation = false;

    @Option(names = {"-w", "--width"}, description = "Line width for source and values (default: ${DEFAULT-VALUE})")
    private int width = 80;

    @Option(names = {"-o", "--output-dir"}, description = "Also append every traced value to <dir>/dbg_output")
    private Path outputDir;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public JDbg() {
        this(System.in, System.out, System.err);
    }

    JDbg(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JDbg()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            TraceRequest request = readRequest();

            TracerConfig config = new TracerConfig(!noLocation, width, colorOutput, Optional.ofNullable(outputDir));
            Tracer tracer = new Tracer(config, out);
            tracer.dbg(request.expression(), request.environment(), request.callSite());

            return 0;
        } catch (Exception e) {
            LOG.debug("Trace request failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private TraceRequest readRequest() throws IOException {
        if (inputFile == null) {
            // stdin belongs to the process, leave it open
            return new TraceRequestReader().read(in, "stdin");
        }
        try (InputStream input = new FileInputStream(inputFile)) {
            return new TraceRequestReader().read(input, inputFile.getName());
        }
    }
}
