package io.indexkit.collections.tools;

import io.indexkit.collections.bplustree.BPlusTree;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;

public class IndexToolTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        return IndexTool.run(
                args,
                new PrintStream(outBytes, true),
                new PrintStream(errBytes, true));
    }

    private String out() {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String keysFile(long... keys) throws Exception {
        final StringBuilder sb = new StringBuilder();
        for (long key : keys) {
            sb.append(key).append('\n');
        }
        final Path file = folder.newFile().toPath();
        Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    @Test
    public void testBPlusPrintsTheTree() throws Exception {
        final String file = keysFile(4, 1, 3, 2, 5);
        assertThat(run(file)).isEqualTo(IndexTool.ExitOk);

        final BPlusTree<Long, Long> expected = new BPlusTree<>(Comparator.<Long>naturalOrder());
        for (long k : new long[] {4, 1, 3, 2, 5}) {
            expected.insert(k, k);
        }
        assertThat(out()).isEqualTo(expected.visualize());
    }

    @Test
    public void testHashPrintsBucketCount() throws Exception {
        final String file = keysFile(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(run("--structure", "hash", "-c", "3", file)).isEqualTo(IndexTool.ExitOk);
        assertThat(out())
                .startsWith("Loading data from " + file + "...")
                .contains("Visualization of the Extendible Hash Table:", "Global Depth: ")
                .containsPattern("Number of buckets: \\d+");
    }

    @Test
    public void testMissingFile() {
        final String file = folder.getRoot().toPath().resolve("nope.txt").toString();
        assertThat(run("-s", "hash", file)).isEqualTo(IndexTool.ExitFailure);
        assertThat(err()).contains("Error: File '" + file + "' not found.");
    }

    @Test
    public void testUsageErrors() throws Exception {
        assertThat(run()).isEqualTo(IndexTool.ExitUsage);
        assertThat(err()).contains("usage: " + IndexTool.Syntax);

        final String file = keysFile(1);
        assertThat(run("-s", "skiplist", file)).isEqualTo(IndexTool.ExitUsage);
        assertThat(err()).contains("unknown structure 'skiplist'");
        assertThat(run("--order", "x", file)).isEqualTo(IndexTool.ExitUsage);
        assertThat(run("--order", "2", file)).isEqualTo(IndexTool.ExitUsage);
        assertThat(run("--bogus", file)).isEqualTo(IndexTool.ExitUsage);
    }

    @Test
    public void testHelp() {
        assertThat(run("-h")).isEqualTo(IndexTool.ExitOk);
        assertThat(out()).contains("--structure", "--global-depth");
    }

    @Test
    public void testStoreDirectoryIsReopened() throws Exception {
        final String store = folder.newFolder("table").toString();
        assertThat(run("-s", "hash", "-d", store, keysFile(1, 2, 3))).isEqualTo(IndexTool.ExitOk);
        outBytes.reset();
        assertThat(run("-s", "hash", "-d", store, keysFile(4, 5))).isEqualTo(IndexTool.ExitOk);
        for (int k = 1; k <= 5; k++) {
            assertThat(out()).contains("Key: " + k + ", Value: " + k);
        }
    }
}
