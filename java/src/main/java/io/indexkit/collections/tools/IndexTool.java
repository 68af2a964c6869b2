package io.indexkit.collections.tools;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import io.indexkit.collections.bplustree.BPlusTree;
import io.indexkit.collections.extendiblehash.BlobStore;
import io.indexkit.collections.extendiblehash.DirectoryBlobStore;
import io.indexkit.collections.extendiblehash.ExtendibleHash;
import io.indexkit.collections.extendiblehash.MemoryBlobStore;
import io.indexkit.collections.extendiblehash.Serdes;
import io.indexkit.collections.extendiblehash.SipKeyHasher;

/**
 * Loads a file of integers into a B+ tree or an extendible hash table and prints the resulting structure.
 */
public final class IndexTool {
    static final String Syntax = "index-tool [options] FILE";

    static final int ExitOk = 0;
    static final int ExitFailure = 1;
    static final int ExitUsage = 2;

    private IndexTool() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static Options options() {
        final Options options = new Options();
        options.addOption(Option.builder("s").longOpt("structure").hasArg().argName("bplus|hash")
                .desc("index structure to load into (default bplus)").build());
        options.addOption(Option.builder("o").longOpt("order").hasArg().argName("N")
                .desc("B+ tree order (default " + BPlusTree.DEFAULT_ORDER + ")").build());
        options.addOption(Option.builder("c").longOpt("capacity").hasArg().argName("N")
                .desc("hash bucket capacity (default " + ExtendibleHash.DEFAULT_BUCKET_CAPACITY + ")").build());
        options.addOption(Option.builder("g").longOpt("global-depth").hasArg().argName("N")
                .desc("initial hash global depth (default " + ExtendibleHash.DEFAULT_GLOBAL_DEPTH + ")").build());
        options.addOption(Option.builder("d").longOpt("store").hasArg().argName("DIR")
                .desc("directory to persist hash buckets in; an existing table there is reopened").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help").build());
        return options;
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final Options options = options();
        final CommandLine cmd;
        final int order, capacity, globalDepth;
        try {
            cmd = new DefaultParser().parse(options, args);
            if (cmd.hasOption("help")) {
                usage(options, out);
                return ExitOk;
            }
            if (cmd.getArgList().size() != 1) {
                throw new ParseException("expected exactly one input file");
            }
            order = intOption(cmd, "order", BPlusTree.DEFAULT_ORDER);
            capacity = intOption(cmd, "capacity", ExtendibleHash.DEFAULT_BUCKET_CAPACITY);
            globalDepth = intOption(cmd, "global-depth", ExtendibleHash.DEFAULT_GLOBAL_DEPTH);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            usage(options, err);
            return ExitUsage;
        }

        final Path file = Paths.get(cmd.getArgList().get(0));
        final String structure = cmd.getOptionValue("structure", "bplus");
        try {
            switch (structure) {
                case "bplus":
                    loadTree(file, order, out);
                    return ExitOk;
                case "hash":
                    loadHash(file, capacity, globalDepth, cmd.getOptionValue("store"), out);
                    return ExitOk;
                default:
                    err.println("Error: unknown structure '" + structure + "'");
                    usage(options, err);
                    return ExitUsage;
            }
        } catch (NoSuchFileException e) {
            err.println("Error: File '" + file + "' not found.");
            return ExitFailure;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitUsage;
        } catch (IOException e) {
            err.println("Error: " + e);
            return ExitFailure;
        }
    }

    private static void loadTree(Path file, int order, PrintStream out) throws IOException {
        final BPlusTree<Long, Long> tree = new BPlusTree<>(order, Comparator.<Long>naturalOrder());
        IntegerFileLoader.load(file, tree::insert);
        out.print(tree.visualize());
    }

    private static void loadHash(Path file, int capacity, int globalDepth, String storeDir, PrintStream out)
            throws IOException {
        final BlobStore store = storeDir == null ? new MemoryBlobStore() : new DirectoryBlobStore(Paths.get(storeDir));
        final ExtendibleHash<Long, Long> eh = ExtendibleHash.open(
                store, Serdes.LONG, Serdes.LONG, new SipKeyHasher<>(Serdes.LONG), capacity, globalDepth);
        out.println("Loading data from " + file + "...");
        IntegerFileLoader.load(file, eh::insert);
        out.println();
        out.println("Visualization of the Extendible Hash Table:");
        out.print(eh.visualize());
        out.println("Number of buckets: " + eh.bucketCount());
    }

    private static int intOption(CommandLine cmd, String name, int defaultValue) throws ParseException {
        final String value = cmd.getOptionValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParseException("--" + name + " needs an integer, got '" + value + "'");
        }
    }

    private static void usage(Options options, PrintStream stream) {
        final PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, 100, Syntax, null, options, 2, 4, null);
        writer.flush();
    }
}
