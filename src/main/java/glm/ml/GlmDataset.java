package glm.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Response vector, covariate rows and prior weights for one fit.
 */
public final class GlmDataset {

    private static final Logger log = LoggerFactory.getLogger(GlmDataset.class);

    private final double[][] design;
    private final double[] response;
    private final double[] weights;

    public GlmDataset(double[][] design, double[] response) {
        this(design, response, response == null ? null : Vectors.ones(response.length));
    }

    public GlmDataset(double[][] design, double[] response, double[] weights) {
        if (design == null || response == null || weights == null) {
            throw new IllegalArgumentException("design, response and weights must be non-null");
        }
        if (design.length != response.length) {
            throw DimensionMismatchException.of("design", design.length, "response", response.length);
        }
        if (weights.length != response.length) {
            throw DimensionMismatchException.of("weights", weights.length, "response", response.length);
        }
        if (response.length == 0) {
            throw new EmptyInputException("Dataset has no observations");
        }
        this.design = design;
        this.response = response;
        this.weights = weights;
    }

    /**
     * Load a dataset from a CSV. Expected: one row per observation, first column = response,
     * remaining columns = covariates. Delimiters: comma, semicolon or tab. Blank lines,
     * '#' comments and non-numeric rows (headers) are skipped.
     */
    public static GlmDataset fromCsv(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path);
        List<Double> responses = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split("[,;\t]+");
            double[] row = new double[parts.length - 1];
            double y;
            try {
                y = Double.parseDouble(parts[0].trim());
                for (int j = 1; j < parts.length; j++) row[j - 1] = Double.parseDouble(parts[j].trim());
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric line {} of {}: {}", i + 1, path, line);
                continue;
            }
            if (!rows.isEmpty() && rows.get(0).length != row.length) {
                throw new DimensionMismatchException("Line " + (i + 1) + " of " + path + " has " + row.length
                    + " covariates, expected " + rows.get(0).length);
            }
            responses.add(y);
            rows.add(row);
        }
        if (responses.isEmpty()) {
            throw new EmptyInputException("No numeric rows in " + path);
        }
        double[] y = responses.stream().mapToDouble(Double::doubleValue).toArray();
        return new GlmDataset(rows.toArray(new double[0][]), y);
    }

    public double[][] design() { return design; }
    public double[] response() { return response; }
    public double[] weights() { return weights; }
    public int size() { return response.length; }
}
