package org.janelia.stars.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.janelia.stars.StarReducer;
import org.janelia.stars.StarReductionParameters;
import org.janelia.stars.StarReductionResult;
import org.janelia.stars.client.parameter.CommandLineParameters;
import org.janelia.stars.detect.StarCandidate;
import org.janelia.stars.error.InvalidParameterException;
import org.janelia.stars.image.ImageNormalizer;
import org.janelia.stars.image.NormalizedImage;
import org.janelia.stars.image.SampleArray;
import org.janelia.stars.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for reducing stars in a single image file.
 * <p>
 * The image is loaded with ImageJ (so any format ImageJ can open is supported), normalized,
 * reduced and written to the output directory as:
 * <ul>
 *     <li>[prefix]final.tif - 32-bit reduced image with one slice per channel,</li>
 *     <li>[prefix]stars.json - detected stars,</li>
 *     <li>[prefix]eroded.tif, [prefix]alpha.tif and [prefix]mask.png - only when intermediates are requested.</li>
 * </ul>
 */
public class StarReductionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Path of the image to process",
                required = true)
        public String input;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for result files",
                required = true)
        public String outputDirectory;

        @Parameter(
                names = "--outputPrefix",
                description = "Prefix for result file names")
        public String outputPrefix = "";

        @Parameter(
                names = "--rawForDetection",
                description = "Detect stars in the raw data (true) or in the normalized data (false)",
                arity = 1)
        public boolean rawForDetection = true;

        @Parameter(
                names = "--threads",
                description = "Number of threads (2 or more runs detection and erosion concurrently)")
        public Integer threads = 1;

        @Parameter(
                names = "--writeIntermediates",
                description = "Also write the eroded image, alpha mask and binary star mask",
                arity = 0)
        public boolean writeIntermediates = false;

        @ParametersDelegate
        public StarReductionParameters reduction = new StarReductionParameters();

        public Path getOutputPath(final String fileName) {
            return Paths.get(outputDirectory, outputPrefix + fileName).toAbsolutePath();
        }
    }

    /**
     * @param  args  see {@link StarReductionClient.Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final StarReductionClient client = new StarReductionClient(parameters);
                client.reduceStars();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public StarReductionClient(final Parameters parameters)
            throws InvalidParameterException {
        InvalidParameterException.requireAtLeast("threads", parameters.threads, 1);
        parameters.reduction.validate();
        this.parameters = parameters;
    }

    public StarReductionResult reduceStars()
            throws IOException {

        final ImagePlus imagePlus = IJ.openImage(parameters.input);
        if (imagePlus == null) {
            throw new IOException("failed to open " + parameters.input);
        }

        final SampleArray raw = ImagePlusConverter.toSampleArray(imagePlus);
        final NormalizedImage normalized = ImageNormalizer.normalize(raw);
        final SampleArray detectionSource = parameters.rawForDetection ? raw : normalized.getImage();

        LOG.info("reduceStars: loaded {} from {}, normalized range [{}, {}]",
                 raw, parameters.input, normalized.getMin(), normalized.getMax());

        final StarReductionResult result;
        final ExecutorService executorService =
                parameters.threads > 1 ? Executors.newFixedThreadPool(parameters.threads - 1) : null;
        try {
            final StarReducer reducer = new StarReducer(executorService);
            result = reducer.reduceStars(detectionSource, normalized.getImage(), parameters.reduction);
        } finally {
            if (executorService != null) {
                executorService.shutdownNow();
            }
        }

        Files.createDirectories(Paths.get(parameters.outputDirectory));

        saveTiff(ImagePlusConverter.toImagePlus("final", result.getFinalImage()),
                 parameters.getOutputPath("final.tif"));

        if (parameters.writeIntermediates) {
            saveTiff(ImagePlusConverter.toImagePlus("eroded", result.getErodedImage()),
                     parameters.getOutputPath("eroded.tif"));
            saveTiff(new ImagePlus("alpha", result.getAlphaMask()),
                     parameters.getOutputPath("alpha.tif"));
            savePng(new ImagePlus("mask", result.getBinaryMask()),
                    parameters.getOutputPath("mask.png"));
        }

        final Path starsPath = parameters.getOutputPath("stars.json");
        final JsonUtils.Helper<StarCandidate> starHelper = new JsonUtils.Helper<>(StarCandidate.class);
        Files.write(starsPath, starHelper.toJsonArray(result.getStars()).getBytes(StandardCharsets.UTF_8));

        LOG.info("reduceStars: exit, saved {} stars to {}", result.getStarCount(), starsPath);

        return result;
    }

    private static void saveTiff(final ImagePlus imagePlus,
                                 final Path path)
            throws IOException {
        final File file = path.toFile();
        if (! new FileSaver(imagePlus).saveAsTiff(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }
        LOG.info("saveTiff: saved {}", file.getAbsolutePath());
    }

    private static void savePng(final ImagePlus imagePlus,
                                final Path path)
            throws IOException {
        final File file = path.toFile();
        if (! new FileSaver(imagePlus).saveAsPng(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }
        LOG.info("savePng: saved {}", file.getAbsolutePath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarReductionClient.class);
}
