package tally.core.output;

import com.google.gson.JsonObject;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import tally.core.exception.ReportOutputException;
import tally.core.helper.AssertHelper;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.instanceOf;

public class OutputChannelTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDebugIsDroppedWhenQuiet() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputChannel channel = OutputChannel.open(true, ReportOutput.stream(bytes, false));

        channel.writeLine(ReportLevel.DEBUG, "[TEST] Suite.testFoo");

        Assert.assertEquals(0, bytes.size());
        Assert.assertTrue(channel.isSuppressed(ReportLevel.DEBUG));
        Assert.assertFalse(channel.isSuppressed(ReportLevel.INFO));
    }

    @Test
    public void testDebugIsWrittenWhenNotQuiet() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.stream(bytes, false));

        channel.writeLine(ReportLevel.DEBUG, "[TEST] Suite.testFoo");

        Assert.assertEquals("[TEST] Suite.testFoo\n", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testInfoIsAlwaysWritten() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputChannel channel = OutputChannel.open(true, ReportOutput.stream(bytes, false));

        channel.writeLine(ReportLevel.INFO, "* Tests:    6");
        channel.writeBytes(ReportLevel.INFO, new byte[]{ 'o', 'k' });

        Assert.assertEquals("* Tests:    6\nok", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testSuppressedWriteNeverRunsAction() {
        OutputChannel channel = OutputChannel.open(true, ReportOutput.stream(new ByteArrayOutputStream(), false));
        channel.write(ReportLevel.DEBUG, (stream) -> { throw new IOException("must not be called"); });
    }

    @Test
    public void testJsonIsFramed() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.stream(bytes, false));

        JsonObject event = new JsonObject();
        event.addProperty("type", "test-start");
        channel.writeJson(ReportLevel.INFO, event);

        Assert.assertEquals("{\"type\":\"test-start\"}\n;;\n", bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testSplitModeWritesOneFilePerReport() throws IOException {
        String prefix = new File(this.folder.getRoot(), "report-").getPath();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.splitFiles(prefix));

        channel.writeLine(ReportLevel.INFO, "first");
        channel.writeLine(ReportLevel.DEBUG, "second");
        channel.close();

        Assert.assertEquals("first\n", read(prefix + 0));
        Assert.assertEquals("second\n", read(prefix + 1));
        Assert.assertFalse(new File(prefix + 2).exists());
        Assert.assertEquals(2, channel.peekNextIndex());
    }

    @Test
    public void testSplitModeDoesNotConsumeIndexForSuppressedReports() throws IOException {
        String prefix = new File(this.folder.getRoot(), "quiet-").getPath();
        OutputChannel channel = OutputChannel.open(true, ReportOutput.splitFiles(prefix));

        channel.writeLine(ReportLevel.DEBUG, "dropped");
        channel.writeLine(ReportLevel.INFO, "kept");

        Assert.assertEquals("kept\n", read(prefix + 0));
        Assert.assertEquals(1, channel.peekNextIndex());
    }

    @Test
    public void testConcurrentSplitWritesUseEachIndexOnce() throws Exception {
        int numReports = 64;
        String prefix = new File(this.folder.getRoot(), "parallel-").getPath();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.splitFiles(prefix));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> writes = new ArrayList<>();
            for (int i = 0; i < numReports; i++) {
                String report = "report " + i;
                writes.add(() -> {
                    channel.writeLine(ReportLevel.INFO, report);
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(writes)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        Set<String> contents = new HashSet<>();
        for (int i = 0; i < numReports; i++) {
            contents.add(read(prefix + i));
        }
        Assert.assertFalse(new File(prefix + numReports).exists());
        Assert.assertEquals(numReports, this.folder.getRoot().listFiles().length);
        Assert.assertEquals(numReports, contents.size());
        Assert.assertEquals(numReports, channel.peekNextIndex());
    }

    @Test
    public void testFileModeWritesAllReportsToOneFile() throws IOException {
        File file = new File(this.folder.getRoot(), "report.txt");
        OutputChannel channel = OutputChannel.open(false, ReportOutput.file(file.getPath()));

        channel.writeLine(ReportLevel.INFO, "one");
        channel.writeLine(ReportLevel.INFO, "two");
        channel.close();
        channel.close();

        Assert.assertEquals("one\ntwo\n", read(file.getPath()));
    }

    @Test
    public void testUnwritableSplitFileIsFatal() {
        String prefix = new File(this.folder.getRoot(), "missing" + File.separator + "report-").getPath();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.splitFiles(prefix));

        ReportOutputException e = AssertHelper.assertThrows(ReportOutputException.class, () -> channel.writeLine(ReportLevel.INFO, "lost"));
        assertThat(e.getCause(), instanceOf(IOException.class));
    }

    @Test
    public void testFailingActionPropagates() {
        OutputChannel channel = OutputChannel.open(false, ReportOutput.stream(new ByteArrayOutputStream(), false));

        ReportOutputException e = AssertHelper.assertThrows(ReportOutputException.class,
                () -> channel.write(ReportLevel.INFO, (stream) -> { throw new IOException("disk full"); }));
        Assert.assertEquals("disk full", e.getCause().getMessage());
    }

    @Test
    public void testFailingSplitWriteStillUsesItsIndex() throws IOException {
        String prefix = new File(this.folder.getRoot(), "failing-").getPath();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.splitFiles(prefix));

        ReportOutputException e = AssertHelper.assertThrows(ReportOutputException.class,
                () -> channel.write(ReportLevel.INFO, (stream) -> {
                    stream.write('x');
                    throw new IOException("disk full");
                }));
        Assert.assertEquals("disk full", e.getCause().getMessage());
        Assert.assertTrue(new File(prefix + 0).exists());
        Assert.assertEquals(1, channel.peekNextIndex());

        channel.writeLine(ReportLevel.INFO, "after");
        Assert.assertEquals("after\n", read(prefix + 1));
        Assert.assertEquals(2, channel.peekNextIndex());
    }

    @Test
    public void testQuietDropsDebugBytesAndJson() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputChannel channel = OutputChannel.open(true, ReportOutput.stream(bytes, false));

        channel.writeBytes(ReportLevel.DEBUG, new byte[]{ 'o', 'k' });
        channel.writeJson(ReportLevel.DEBUG, startEvent());

        Assert.assertEquals(0, bytes.size());
    }

    @Test
    public void testQuietDropsDebugBytesAndJsonInSplitMode() {
        String prefix = new File(this.folder.getRoot(), "dropped-").getPath();
        OutputChannel channel = OutputChannel.open(true, ReportOutput.splitFiles(prefix));

        channel.writeBytes(ReportLevel.DEBUG, new byte[]{ 'o', 'k' });
        channel.writeJson(ReportLevel.DEBUG, startEvent());

        Assert.assertEquals(0, this.folder.getRoot().listFiles().length);
        Assert.assertEquals(0, channel.peekNextIndex());
    }

    @Test
    public void testSplitFilesAreListedByIndex() throws IOException {
        String prefix = new File(this.folder.getRoot(), "ordered-").getPath();
        OutputChannel channel = OutputChannel.open(false, ReportOutput.splitFiles(prefix));
        for (int i = 0; i < 3; i++) {
            channel.writeLine(ReportLevel.INFO, "line " + i);
        }

        List<String> names = new ArrayList<>();
        for (File file : this.folder.getRoot().listFiles()) {
            names.add(file.getName());
        }
        assertThat(names, containsInAnyOrder("ordered-0", "ordered-1", "ordered-2"));
    }

    private static JsonObject startEvent() {
        JsonObject event = new JsonObject();
        event.addProperty("type", "test-start");
        return event;
    }

    private static String read(String path) throws IOException {
        return new String(Files.readAllBytes(new File(path).toPath()), StandardCharsets.UTF_8);
    }
}
