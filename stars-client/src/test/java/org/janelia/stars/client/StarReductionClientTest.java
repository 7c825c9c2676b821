package org.janelia.stars.client;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.janelia.stars.StarReductionResult;
import org.janelia.stars.client.parameter.CommandLineParameters;
import org.janelia.stars.detect.StarCandidate;
import org.janelia.stars.json.JsonUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link StarReductionClient} class.
 */
public class StarReductionClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() {
        CommandLineParameters.parseHelp(new StarReductionClient.Parameters());
    }

    @Test
    public void testReduceStars() throws IOException {

        final File inputFile = new File(temporaryFolder.getRoot(), "field.tif");
        final File outputDirectory = new File(temporaryFolder.getRoot(), "out");

        final FloatProcessor field = new FloatProcessor(40, 30);
        field.setf(20, 15, 500.0f);
        field.setf(8, 22, 300.0f);
        Assert.assertTrue("failed to save test input",
                          new FileSaver(new ImagePlus("field", field)).saveAsTiff(inputFile.getAbsolutePath()));

        final StarReductionClient.Parameters parameters = new StarReductionClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--input", inputFile.getAbsolutePath(),
                "--outputDirectory", outputDirectory.getAbsolutePath(),
                "--outputPrefix", "test_",
                "--threads", "2",
                "--writeIntermediates",
                "--maskRadius", "3"
        }, StarReductionClient.class, false);

        Assert.assertTrue("arguments should have been parsed", parsed);
        Assert.assertEquals("invalid maskRadius", 3.0, parameters.reduction.mask.maskRadius, 0.0);

        final StarReductionResult result = new StarReductionClient(parameters).reduceStars();

        Assert.assertEquals("invalid star count", 2, result.getStarCount());

        for (final String name : new String[] { "final.tif", "eroded.tif", "alpha.tif", "mask.png", "stars.json" }) {
            Assert.assertTrue(name + " was not written", new File(outputDirectory, "test_" + name).exists());
        }

        final ImagePlus finalImage = IJ.openImage(new File(outputDirectory, "test_final.tif").getAbsolutePath());
        Assert.assertNotNull("failed to open final image", finalImage);
        Assert.assertEquals("invalid final width", 40, finalImage.getWidth());
        Assert.assertEquals("invalid final height", 30, finalImage.getHeight());
        Assert.assertEquals("invalid final bit depth", 32, finalImage.getBitDepth());

        final String starsJson = new String(Files.readAllBytes(new File(outputDirectory, "test_stars.json").toPath()),
                                            StandardCharsets.UTF_8);
        final List<StarCandidate> stars = new JsonUtils.Helper<>(StarCandidate.class).fromJsonArray(starsJson);
        Assert.assertEquals("invalid number of saved stars", 2, stars.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreads() {
        final StarReductionClient.Parameters parameters = new StarReductionClient.Parameters();
        parameters.threads = 0;
        new StarReductionClient(parameters);
    }

}
