package tally.core.config;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import tally.core.exception.ParseException;
import tally.core.helper.AssertHelper;
import tally.core.output.color.AnsiColorizer;
import tally.core.output.color.PlainColorizer;
import tally.core.report.DefaultReporters;
import tally.core.util.Logger;

import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

public class RunConfigLoaderTest {

    @After
    public void disableLogging() {
        Logger.globalDisable();
    }

    @Test
    public void testDefaults() throws ParseException {
        RunConfig config = RunConfigLoader.fromProperties(new Properties());

        Assert.assertEquals(1, config.reporters.size());
        Assert.assertEquals(DefaultReporters.HUMAN_SEQUENTIAL, config.reporters.get(0).id());
        Assert.assertFalse(config.quiet);
        Assert.assertFalse(config.output.isSplit());
        Assert.assertFalse(config.output.isFile());
        Assert.assertSame(PlainColorizer.plain(), config.colorizer);
    }

    @Test
    public void testParallelMachineQuietColors() throws ParseException {
        Properties properties = new Properties();
        properties.setProperty(RunConfigLoader.PARALLEL_PROPERTY, "true");
        properties.setProperty(RunConfigLoader.MACHINE_OUTPUT_PROPERTY, "TRUE");
        properties.setProperty(RunConfigLoader.QUIET_PROPERTY, " true ");
        properties.setProperty(RunConfigLoader.COLORS_PROPERTY, "true");

        RunConfig config = RunConfigLoader.fromProperties(properties);

        Assert.assertEquals(DefaultReporters.MACHINE_PARALLEL, config.reporters.get(0).id());
        Assert.assertTrue(config.quiet);
        Assert.assertSame(AnsiColorizer.ansi(), config.colorizer);
    }

    @Test
    public void testOutputFileAndSplit() throws ParseException {
        Properties properties = new Properties();
        properties.setProperty(RunConfigLoader.OUTPUT_FILE_PROPERTY, "/tmp/report");
        Assert.assertTrue(RunConfigLoader.fromProperties(properties).output.isFile());

        properties.setProperty(RunConfigLoader.SPLIT_OUTPUT_PROPERTY, "true");
        RunConfig config = RunConfigLoader.fromProperties(properties);
        Assert.assertTrue(config.output.isSplit());
        Assert.assertFalse(config.output.isFile());
    }

    @Test
    public void testSplitRequiresOutputFile() {
        Properties properties = new Properties();
        properties.setProperty(RunConfigLoader.SPLIT_OUTPUT_PROPERTY, "true");

        ParseException e = AssertHelper.assertThrows(ParseException.class, () -> RunConfigLoader.fromProperties(properties));
        Assert.assertEquals(RunConfigLoader.SPLIT_OUTPUT_PROPERTY, e.getProperty());
    }

    @Test
    public void testMalformedBoolean() {
        Properties properties = new Properties();
        properties.setProperty(RunConfigLoader.QUIET_PROPERTY, "yes");

        ParseException e = AssertHelper.assertThrows(ParseException.class, () -> RunConfigLoader.fromProperties(properties));
        Assert.assertEquals(RunConfigLoader.QUIET_PROPERTY, e.getProperty());
        assertThat(e.getMessage(), containsString("yes"));
    }

    @Test
    public void testEnableLogger() throws ParseException {
        Properties properties = new Properties();
        properties.setProperty(RunConfigLoader.ENABLE_LOGGER_PROPERTY, "true");

        RunConfigLoader.fromProperties(properties);

        Assert.assertTrue(Logger.isGlobalEnabled());
    }

    @Test
    public void testBuilderSettersAreSetOnce() {
        RunConfig.Builder builder = RunConfig.Builder.newBuilder().setQuiet(true);
        AssertHelper.assertThrows(IllegalStateException.class, () -> builder.setQuiet(false));
    }
}
