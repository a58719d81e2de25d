package ca.uwaterloo.swag.flowlens;

import ca.uwaterloo.swag.flowlens.export.AnalysisExporter;
import ca.uwaterloo.swag.flowlens.export.GraphExporter;
import ca.uwaterloo.swag.flowlens.models.AnalysisResult;
import ca.uwaterloo.swag.flowlens.models.LineRecord;
import ca.uwaterloo.swag.flowlens.util.ArgumentOptions;
import ca.uwaterloo.swag.flowlens.util.FunctionCatalog;
import ca.uwaterloo.swag.flowlens.util.MODE;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

public class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final Logger packageLog = Logger.getLogger(Main.class.getPackageName());

    public static void main(String[] args) {
        run(args);
    }

    public static AnalysisResult run(String[] args) {
        long start = System.currentTimeMillis();
        final ArgumentOptions argumentOptions = processArguments(args);
        final MODE mode = argumentOptions.hasFlag("debug") ? MODE.DEBUG : MODE.EXECUTE;
        configureLogging(mode);

        final List<String> allocationFunctions = loadFunctions(argumentOptions, "-allocators",
            FunctionCatalog.DEFAULT_ALLOCATION_FUNCTIONS_FILE);
        final List<String> deallocationFunctions = loadFunctions(argumentOptions, "-deallocators",
            FunctionCatalog.DEFAULT_DEALLOCATION_FUNCTIONS_FILE);

        final String sourceText = readSource(argumentOptions.sourceFile);
        final AnalysisResult result = new FlowLens(allocationFunctions, deallocationFunctions).analyze(sourceText);

        final File outputDir = new File(argumentOptions.option("-out", "."));
        exportResults(outputDir, sourceText, result, argumentOptions.hasFlag("dot"));

        for (String syntaxError : result.getSyntaxErrors()) {
            System.err.println(syntaxError);
        }
        if (mode.dumpLineAnalysis()) {
            dumpLineAnalysis(result);
        }

        long end = System.currentTimeMillis();
        System.out.println("Lines: " + result.getSourceLines().size() + " | Variables: " +
            result.getVariables().size() + " | Dependencies: " + result.getDependencies().size() + " | Blocks: " +
            result.getBlocks().size());
        System.out.println("Completed analysis in " + (end - start) + "ms");
        return result;
    }

    private static void configureLogging(MODE mode) {
        packageLog.setLevel(mode.logLevel());
        if (mode.logLevel().intValue() < Level.INFO.intValue() && packageLog.getHandlers().length == 0) {
            Handler handler = new ConsoleHandler();
            handler.setLevel(mode.logLevel());
            packageLog.addHandler(handler);
        }
    }

    private static List<String> loadFunctions(ArgumentOptions argumentOptions, String optionName,
                                              String defaultResource) {
        if (argumentOptions.optsList.containsKey(optionName)) {
            return FunctionCatalog.loadFile(argumentOptions.optsList.get(optionName));
        }
        return FunctionCatalog.loadResource(defaultResource);
    }

    private static String readSource(String sourceFile) {
        File file = new File(sourceFile);
        if (!file.isFile()) {
            throw new IllegalArgumentException("Not a readable C source file: " + sourceFile);
        }
        try {
            return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.log(Level.SEVERE, "Error reading source file " + sourceFile, e);
            throw new RuntimeException(e);
        }
    }

    private static void exportResults(File outputDir, String sourceText, AnalysisResult result, boolean exportDot) {
        try {
            AnalysisExporter analysisExporter = new AnalysisExporter(Clock.systemDefaultZone());
            for (File exported : analysisExporter.exportAll(outputDir, sourceText, result)) {
                System.out.println("Exported " + exported.getPath());
            }
            if (exportDot) {
                System.out.println("Exporting graphs...");
                new GraphExporter().exportAll(outputDir, result.getDependencyGraph(), result.getBlocks(),
                    result.getArcs());
            }
        } catch (IOException e) {
            log.log(Level.SEVERE, "Error writing analysis output to " + outputDir.getPath(), e);
            throw new RuntimeException(e);
        }
    }

    private static void dumpLineAnalysis(AnalysisResult result) {
        for (LineRecord lineRecord : result.getLineAnalysis().values()) {
            System.out.println(lineRecord);
        }
    }

    static ArgumentOptions processArguments(String[] args) {
        List<String> argsList = new ArrayList<>();
        Map<String, String> optsList = new HashMap<>();
        List<String> doubleOptsList = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].isEmpty()) {
                throw new IllegalArgumentException("Not a valid argument: " + args[i]);
            }
            if (args[i].charAt(0) == '-') {
                if (args[i].length() < 2) {
                    throw new IllegalArgumentException("Not a valid argument: " + args[i]);
                }
                if (args[i].charAt(1) == '-') {
                    if (args[i].length() < 3) {
                        throw new IllegalArgumentException("Not a valid argument: " + args[i]);
                    }
                    // --opt
                    doubleOptsList.add(args[i].substring(2));
                } else {
                    if (args.length - 1 == i) {
                        throw new IllegalArgumentException("Expected arg after: " + args[i]);
                    }
                    // -opt
                    optsList.put(args[i], args[i + 1]);
                    i++;
                }
            } else { // arg
                argsList.add(args[i]);
            }
        }
        if (argsList.isEmpty()) {
            throw new IllegalArgumentException("Expected a C source file. Usage: flowlens <source.c> [-out <dir>] " +
                "[-allocators <xml>] [-deallocators <xml>] [--dot] [--debug]");
        }
        return new ArgumentOptions(argsList, optsList, doubleOptsList, argsList.get(0));
    }
}
