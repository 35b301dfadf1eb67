package glm;

import glm.api.SampleData;
import glm.ml.GeneralizedLinearModel;
import glm.ml.GlmDataset;
import glm.ml.Vectors;

import java.nio.file.Paths;

/**
 * Demo: a linear model and a Poisson model fitted on the same count data.
 * An optional CSV path (first column response, then covariates) replaces the sample data.
 */
public class Main {

    public static void main(String[] args) {
        double[][] design = SampleData.design();
        double[] response = SampleData.response();
        double[] weights = Vectors.ones(response.length);

        if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
            try {
                GlmDataset data = GlmDataset.fromCsv(Paths.get(args[0].trim()));
                design = data.design();
                response = data.response();
                weights = data.weights();
            } catch (Exception e) {
                String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                System.err.println("CSV error: " + msg);
                System.exit(1);
            }
        }

        try {
            // --- Gaussian family, identity link: ordinary least squares
            GeneralizedLinearModel linear = GeneralizedLinearModel.weightedLeastSquares(design, response, weights);
            System.out.println("=== Linear model (Gaussian, identity) ===");
            System.out.println(linear);

            // --- Poisson family, log link
            GeneralizedLinearModel poisson = GeneralizedLinearModel.poissonRegression(design, response, weights);
            System.out.println("=== Poisson model (log link) ===");
            System.out.println(poisson);
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Fit error: " + msg);
            System.exit(2);
        }
    }
}
