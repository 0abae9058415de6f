package app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import hw.BatteryMonitor;
import image.PixelBuffer;
import io.ImageLoader;
import io.ImageSaver;
import ops.OperationKind;
import ops.OperationRegistry;
import ops.ParamSpec;
import ops.ValidationException;
import pipeline.BatchJob;
import pipeline.BatchProcessor;
import pipeline.BatchResult;
import pipeline.Operation;
import pipeline.Pipeline;
import pipeline.PipelineExecutionException;
import pipeline.PipelineExecutor;
import preset.Preset;
import preset.PresetLibrary;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command line entry for the editing pipeline.
 * Examples:
 * # one image, explicit operations
 * java -jar image-edit-pipeline.jar --input photo.jpg --op brightness:amount=20 --op "crop:x=0;y=0;w=640;h=480"
 * --output out.png
 *
 * # a preset with a variable, several images, GPU for pointwise stages
 * java -DuseGPU=true -jar image-edit-pipeline.jar --preset vintage --var warmth=4500 --input a.jpg --input b.png
 * --output-dir edited
 */
public final class CLI {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;
    static final int EXIT_VALIDATION = 3;
    static final int EXIT_EXECUTION = 4;

    // -------------------- Args --------------------
    static final class Args {
        @Parameter(names = "--input", description = "Input image path (.png/.jpg/...), repeatable")
        List<String> inputs = new ArrayList<>();

        @Parameter(names = "--op", splitter = NoSplitter.class,
                description = "Operation kind[:name=value;name=value], repeatable, applied in order")
        List<String> ops = new ArrayList<>();

        @Parameter(names = "--preset", description = "Preset name, applied before any --op")
        String preset;

        @Parameter(names = "--presets", description = "JSON file with additional presets")
        String presetsFile;

        @Parameter(names = "--var", splitter = NoSplitter.class, description = "Preset variable name=value, repeatable")
        List<String> vars = new ArrayList<>();

        @Parameter(names = "--output", description = "Output file (single input only)")
        String output;

        @Parameter(names = "--output-dir", description = "Directory for outputs; default: next to each input")
        String outputDir;

        @Parameter(names = "--threads", description = "Batch workers; default: from power state")
        Integer threads;

        @Parameter(names = "--gpu", description = "Use GPU acceleration (OpenCL). Also honored via -DuseGPU=true")
        boolean gpu = false;

        @Parameter(names = "--list", description = "List operation kinds, parameters and presets")
        boolean list = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    private final PrintStream out;
    private final PrintStream err;

    CLI(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] argv) {
        int code = new CLI(System.out, System.err).run(argv);
        if (code != EXIT_OK)
            System.exit(code);
    }

    int run(String[] argv) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("image-edit").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            err.println(pe.getMessage());
            usage(jc);
            return EXIT_USAGE;
        }
        if (args.help) {
            usage(jc);
            return EXIT_OK;
        }

        PresetLibrary presets;
        try {
            presets = PresetLibrary.builtIn();
            if (args.presetsFile != null)
                presets = presets.merge(PresetLibrary.load(Paths.get(args.presetsFile)));
        } catch (IOException e) {
            err.println("Cannot read presets: " + e.getMessage());
            return EXIT_IO;
        }

        if (args.list) {
            printCatalog(presets);
            return EXIT_OK;
        }

        if (args.inputs.isEmpty()) {
            err.println("At least one --input is required");
            usage(jc);
            return EXIT_USAGE;
        }
        if (args.output != null && args.inputs.size() > 1) {
            err.println("--output takes a single --input; use --output-dir for several");
            return EXIT_USAGE;
        }
        if (args.threads != null && args.threads < 1) {
            err.println("--threads must be >= 1");
            return EXIT_USAGE;
        }

        // -------------------- Pipeline --------------------
        Pipeline pipeline;
        try {
            pipeline = buildPipeline(args, presets);
        } catch (ValidationException e) {
            err.println("Invalid " + describe(e));
            return EXIT_VALIDATION;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        // Read GPU preference from CLI flag OR JVM property (-DuseGPU=true)
        boolean userWantsGPU = args.gpu || Boolean.parseBoolean(System.getProperty("useGPU", "false"));
        BatteryMonitor.PowerState power = BatteryMonitor.current();
        boolean gpu = BatteryMonitor.gpuAllowed(power, userWantsGPU);
        PipelineExecutor executor = new PipelineExecutor(gpu);

        // Banner
        out.println("== Image Edit Pipeline ==");
        out.println("Pipeline: " + pipeline);
        out.println("GPU: " + gpu + (userWantsGPU && !gpu ? " (battery " + power.batteryLevel() + "%)" : ""));

        // -------------------- Load --------------------
        int exit = EXIT_OK;
        List<BatchJob> jobs = new ArrayList<>();
        for (String in : args.inputs) {
            try {
                jobs.add(new BatchJob(in, ImageLoader.load(Paths.get(in)), pipeline));
            } catch (IOException e) {
                err.println("Cannot read " + in + ": " + e.getMessage());
                exit = EXIT_IO;
            }
        }

        // -------------------- Execute & save --------------------
        long t0 = System.nanoTime();
        List<BatchResult> results;
        try (BatchProcessor batch = args.threads != null
                ? new BatchProcessor(args.threads, executor)
                : BatchProcessor.fromPowerPolicy(executor, jobs.size() > 1)) {
            results = batch.process(jobs);
        } catch (InterruptedException e) {
            err.println("Processing interrupted: " + e.getMessage());
            Thread.currentThread().interrupt();
            return EXIT_EXECUTION;
        }

        for (BatchResult r : results) {
            switch (r.status()) {
                case SUCCEEDED -> {
                    Path target = outputPath(args, Paths.get(r.id()));
                    try {
                        Path written = ImageSaver.save(r.output(), target);
                        out.println(r.id() + " -> " + written + String.format(" (%.2f ms)", r.millis()));
                    } catch (IOException e) {
                        err.println("Failed to write " + target + ": " + e.getMessage());
                        exit = Math.max(exit, EXIT_IO);
                    }
                }
                case FAILED -> {
                    PipelineExecutionException e = r.error();
                    err.println(r.id() + ": stage " + e.getStageIndex() + " (" + e.getKind().id() + ") failed: "
                            + e.getCause().getMessage());
                    exit = Math.max(exit, EXIT_EXECUTION);
                }
                case CANCELLED -> err.println(r.id() + ": cancelled");
            }
        }
        out.println("Total processing: " + String.format("%.2f", (System.nanoTime() - t0) / 1e6) + " ms");
        return exit;
    }

    static Pipeline buildPipeline(Args args, PresetLibrary presets) throws ValidationException {
        Pipeline.Builder builder = Pipeline.builder();
        if (args.preset != null) {
            Preset preset = presets.get(args.preset)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown preset '" + args.preset + "'"));
            for (Operation op : preset.instantiate(OpSpecParser.parseVariables(args.vars)).operations())
                builder.add(op);
        } else if (!args.vars.isEmpty()) {
            throw new IllegalArgumentException("--var needs a --preset");
        }
        for (String spec : args.ops)
            builder.add(OpSpecParser.parse(spec));
        return builder.build();
    }

    static Path outputPath(Args args, Path input) {
        if (args.output != null)
            return Paths.get(args.output);
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        Path dir = args.outputDir != null ? Paths.get(args.outputDir) : input.toAbsolutePath().getParent();
        return dir.resolve(stem + "-edited.png");
    }

    static String describe(ValidationException e) {
        StringBuilder sb = new StringBuilder();
        if (e.getParameter() != null)
            sb.append("parameter '").append(e.getParameter()).append("'");
        else
            sb.append("input");
        if (e.getKind() != null)
            sb.append(" of ").append(e.getKind());
        return sb.append(": ").append(e.getReason()).toString();
    }

    private void usage(JCommander jc) {
        StringBuilder sb = new StringBuilder();
        jc.getUsageFormatter().usage(sb);
        out.print(sb);
    }

    private void printCatalog(PresetLibrary presets) {
        OperationRegistry registry = OperationRegistry.standard();
        OperationKind.Category current = null;
        for (OperationKind kind : OperationKind.values()) {
            if (kind.category() != current) {
                current = kind.category();
                out.println(current.name().toLowerCase() + ":");
            }
            String params = registry.schema(kind).params().stream()
                    .map(ParamSpec::describe)
                    .collect(Collectors.joining(", "));
            out.println("  " + kind.id() + (params.isEmpty() ? "" : "  " + params));
        }
        out.println("presets:");
        for (Preset p : presets.all()) {
            Map<String, Object> vars = p.variables();
            out.println("  " + p.name() + "  " + p.description() + (vars.isEmpty() ? "" : "  variables " + vars));
        }
    }
}
