/*-
 * #%L
 * This file is part of CerviScan.
 * %%
 * Copyright (C) 2024 - 2025 CerviScan developers
 * %%
 * CerviScan is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * CerviScan is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with CerviScan.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package cerviscan;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import cerviscan.lib.analysis.features.FeatureExtractionParameters;
import cerviscan.lib.analysis.features.FeatureVectorAssembler;
import cerviscan.lib.analysis.features.TamuraFeatures;
import cerviscan.lib.common.ThreadTools;
import cerviscan.lib.images.ImageIoTools;
import cerviscan.lib.io.GsonTools;
import cerviscan.lib.measurements.FeatureVector;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command to extract feature vectors from one or more image files.
 * <p>
 * Each image is processed independently. If an image cannot be read or processed, the error is logged,
 * the image is skipped and the command returns a non-zero exit code after processing the remaining images.
 *
 * @author CerviScan developers
 *
 */
@Command(name = "extract", description = {
		"Extract texture and color feature vectors from image files.",
		"Results are written as JSON (default) or CSV."})
class ExtractCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ExtractCommand.class);

	/**
	 * Supported output formats.
	 */
	enum OutputFormat { JSON, CSV }

	@Parameters(arity = "1..*", description = "Paths to the image files.", paramLabel = "image")
	private List<Path> images = new ArrayList<>();

	@Option(names = {"-p", "--params"}, description = "JSON file containing feature extraction parameters.", paramLabel = "params")
	private Path paramsPath;

	@Option(names = {"-o", "--output"}, description = "Output file (default is to write to standard output).", paramLabel = "output")
	private Path outputPath;

	@Option(names = {"-f", "--format"}, description = {"Output format (default = JSON).", "Options: ${COMPLETION-CANDIDATES}"}, paramLabel = "format")
	private OutputFormat format = OutputFormat.JSON;

	@Option(names = {"-t", "--threads"}, description = "Number of images to process in parallel (default = number of processors).", paramLabel = "threads")
	private int nThreads = ThreadTools.getParallelism();

	@Option(names = {"--lbp-output"}, description = "Directory in which to write the local binary pattern image for each input.", paramLabel = "directory")
	private Path lbpOutputDir;

	@Option(names = {"--keep-constant"}, description = "Keep features with a value of exactly 1.0.")
	private boolean keepConstant;

	@Option(names = {"--include-glcm"}, description = "Append gray-level co-occurrence features.")
	private boolean includeCooccurrence;

	@Option(names = {"--include-lbp-glrlm"}, description = "Append run-length features of the local binary pattern image.")
	private boolean includeLbpRunLength;

	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() throws Exception {
		var params = buildParameters();
		logger.debug("Feature extraction parameters: {}", params);
		var assembler = new FeatureVectorAssembler(params, new TamuraFeatures());

		if (lbpOutputDir != null)
			Files.createDirectories(lbpOutputDir);

		var results = new ArrayList<ImageFeatures>();
		var pool = ThreadTools.createFixedThreadPool("cerviscan-extract-", Math.min(nThreads, images.size()));
		try {
			var futures = new ArrayList<Future<FeatureVector>>();
			for (var path : images)
				futures.add(pool.submit(() -> processImage(assembler, path)));
			for (int i = 0; i < futures.size(); i++) {
				var path = images.get(i);
				try {
					results.add(new ImageFeatures(path, futures.get(i).get()));
				} catch (ExecutionException e) {
					var cause = e.getCause() == null ? e : e.getCause();
					logger.error("Unable to process " + path + ": " + cause.getLocalizedMessage(), cause);
				}
			}
		} finally {
			pool.shutdownNow();
		}

		writeResults(assembler, results);

		int nFailed = images.size() - results.size();
		if (nFailed > 0) {
			logger.warn("Feature extraction failed for {}/{} images", nFailed, images.size());
			return 1;
		}
		logger.info("Extracted features for {} images", results.size());
		return 0;
	}

	FeatureExtractionParameters buildParameters() throws IOException {
		var params = paramsPath == null ? FeatureExtractionParameters.getDefaultInstance() : FeatureExtractionParameters.readJson(paramsPath);
		var builder = FeatureExtractionParameters.builder(params);
		if (keepConstant)
			builder.dropConstantFeatures(false);
		if (includeCooccurrence)
			builder.includeCooccurrence(true);
		if (includeLbpRunLength)
			builder.includeLbpRunLength(true);
		return builder.build();
	}

	private FeatureVector processImage(FeatureVectorAssembler assembler, Path path) throws IOException {
		logger.info("Processing {}", path);
		var rgb = ImageIoTools.readRGB(path);
		var extraction = assembler.extractWithImages(rgb);
		if (lbpOutputDir != null) {
			var name = path.getFileName().toString();
			int ind = name.lastIndexOf('.');
			if (ind > 0)
				name = name.substring(0, ind);
			ImageIoTools.writeImage(ImageIoTools.toBufferedImage(extraction.getLocalBinaryPatternImage()), lbpOutputDir.resolve(name + "-lbp.png"));
		}
		return extraction.getFeatures();
	}

	private void writeResults(FeatureVectorAssembler assembler, List<ImageFeatures> results) throws IOException {
		if (outputPath == null) {
			var writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			writeResults(writer, assembler, results);
			writer.flush();
		} else {
			try (var writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
				writeResults(writer, assembler, results);
			}
			logger.info("Results written to {}", outputPath);
		}
	}

	void writeResults(Writer writer, FeatureVectorAssembler assembler, List<ImageFeatures> results) throws IOException {
		switch (format) {
		case CSV:
			writeCSV(writer, assembler.getAllFeatureNames(), results);
			break;
		case JSON:
		default:
			GsonTools.getInstance(true).toJson(results, writer);
			writer.write(System.lineSeparator());
			break;
		}
	}

	/**
	 * Write one row per image, with one column per feature.
	 * Features that were removed from an image's vector are left blank.
	 */
	static void writeCSV(Writer writer, List<String> names, List<ImageFeatures> results) throws IOException {
		var sb = new StringBuilder("image");
		for (var name : names)
			sb.append(',').append(name);
		writer.write(sb.toString());
		writer.write(System.lineSeparator());
		for (var result : results) {
			sb.setLength(0);
			sb.append(escapeCSV(result.image));
			for (var name : names) {
				sb.append(',');
				if (result.features.containsKey(name))
					sb.append(result.features.get(name));
			}
			writer.write(sb.toString());
			writer.write(System.lineSeparator());
		}
	}

	private static String escapeCSV(String value) {
		if (value.contains(",") || value.contains("\"") || value.contains("\n"))
			return "\"" + value.replace("\"", "\"\"") + "\"";
		return value;
	}


	/**
	 * Features computed for a single image, as written to JSON.
	 */
	static class ImageFeatures {

		private String image;
		private FeatureVector features;

		ImageFeatures(Path path, FeatureVector features) {
			this.image = path.toString();
			this.features = features;
		}

		String getImage() {
			return image;
		}

		FeatureVector getFeatures() {
			return features;
		}

	}

}
