package glm.ml.distribution;

import glm.ml.Vectors;
import glm.ml.link.LinkFunction;

/** Link ownership and the family-independent parts of IRLS. */
abstract class AbstractDistribution implements Distribution {

    static final String[] DEVIANCE_ARGS = {"response", "meanResponse", "weights"};

    private final LinkFunction link;

    AbstractDistribution(LinkFunction link) {
        this.link = link;
    }

    @Override
    public final LinkFunction getLinkFunction() {
        return link;
    }

    @Override
    public double[] initialMean(double[] response) {
        double mean = Vectors.mean(response);
        double[] initial = new double[response.length];
        for (int i = 0; i < response.length; i++) {
            initial[i] = 0.5 * (response[i] + mean);
        }
        return initial;
    }

    @Override
    public double[] predict(double[] meanResponse) {
        return link.evaluate(meanResponse);
    }

    @Override
    public double[] fit(double[] linearPrediction) {
        return link.inverse(linearPrediction);
    }

    void checkDevianceArguments(double[] response, double[] meanResponse, double[] weights, double scale) {
        Vectors.requireSameLength(DEVIANCE_ARGS, response, meanResponse, weights);
        Vectors.requirePositiveScale(scale);
    }
}
