package glm.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import glm.ml.DimensionMismatchException;
import glm.ml.DomainException;
import glm.ml.EmptyInputException;
import glm.ml.GeneralizedLinearModel;
import glm.ml.IrlsSettings;
import glm.ml.NonConvergenceException;
import glm.ml.SingularDesignException;
import glm.ml.distribution.Distribution;
import glm.ml.distribution.GaussianDistribution;
import glm.ml.distribution.PoissonDistribution;
import glm.ml.link.IdentityLinkFunction;
import glm.ml.link.LinkFunction;
import glm.ml.link.LogLinkFunction;
import glm.ml.link.LogitLinkFunction;
import glm.ml.link.PowerLinkFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a JSON fit request into a JSON-ready result map.
 * <p>
 * Request: {@code {"design": [[...]], "response": [...], "weights": [...]?, "family": "gaussian"|"poisson",
 * "link": "identity"|"log"|"logit"|"reciprocal"?, "intercept": true?, "maxIterations": 100?}}.
 * Failures come back as {@code {"error": message, "type": kind}}.
 */
public class FitRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(FitRequestHandler.class);

    static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

    private final IrlsSettings baseSettings;

    public FitRequestHandler(IrlsSettings baseSettings) {
        this.baseSettings = baseSettings;
    }

    /** Request body as mapped by Gson. */
    static class FitRequest {
        double[][] design;
        double[] response;
        double[] weights;
        String family;
        String link;
        Boolean intercept;
        Integer maxIterations;
    }

    public Map<String, Object> handle(String body) {
        try {
            if (body == null || body.isBlank()) {
                return error("bad_request", "Missing request body");
            }
            FitRequest req = GSON.fromJson(body, FitRequest.class);
            if (req == null || req.design == null || req.response == null) {
                return error("bad_request", "Missing 'design' or 'response'");
            }
            double[] weights = req.weights;
            if (weights == null) {
                weights = new double[req.response.length];
                Arrays.fill(weights, 1.0);
            }
            IrlsSettings settings = req.maxIterations == null
                ? baseSettings
                : baseSettings.withMaxIterations(req.maxIterations);
            boolean intercept = req.intercept == null || req.intercept;

            GeneralizedLinearModel model = new GeneralizedLinearModel(
                req.design, req.response, weights, distribution(req.family, req.link), intercept, settings);
            return toResult(model);
        } catch (JsonParseException e) {
            return error("bad_request", "Invalid JSON: " + e.getMessage());
        } catch (DimensionMismatchException e) {
            return error("dimension_mismatch", e.getMessage());
        } catch (EmptyInputException e) {
            return error("empty_input", e.getMessage());
        } catch (DomainException e) {
            return error("domain_error", e.getMessage());
        } catch (SingularDesignException e) {
            return error("singular_design", e.getMessage());
        } catch (NonConvergenceException e) {
            Map<String, Object> out = error("non_convergence", e.getMessage());
            out.put("lastCoefficients", e.getLastCoefficients());
            return out;
        } catch (IllegalArgumentException e) {
            return error("bad_request", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Fit request failed", e);
            String msg = e.getMessage();
            return error("internal_error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
        }
    }

    static Distribution distribution(String family, String link) {
        String f = family == null ? "gaussian" : family.trim().toLowerCase(Locale.ROOT);
        LinkFunction l = link == null ? null : linkFunction(link);
        switch (f) {
            case "gaussian":
            case "normal":
                return new GaussianDistribution(l);
            case "poisson":
                return new PoissonDistribution(l);
            default:
                throw new IllegalArgumentException("Unknown family '" + family + "'");
        }
    }

    static LinkFunction linkFunction(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "identity": return new IdentityLinkFunction();
            case "log": return new LogLinkFunction();
            case "logit": return new LogitLinkFunction();
            case "reciprocal":
            case "inverse": return PowerLinkFunction.reciprocal();
            default: throw new IllegalArgumentException("Unknown link '" + name + "'");
        }
    }

    static Map<String, Object> toResult(GeneralizedLinearModel model) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("family", model.getDistribution().getClass().getSimpleName());
        out.put("link", model.getDistribution().getLinkFunction().toString());
        out.put("observationCount", model.getObservationCount());
        out.put("variableCount", model.getVariableCount());
        out.put("degreesOfFreedom", model.getDegreesOfFreedom());
        out.put("coefficients", model.getCoefficients());
        Map<String, Object> se = new LinkedHashMap<>();
        se.put("ols", model.getStandardErrorsOls());
        se.put("hc0", model.getStandardErrorsHC0());
        se.put("hc1", model.getStandardErrorsHC1());
        out.put("standardErrors", se);
        out.put("sumSquaredErrors", model.getSumSquaredErrors());
        out.put("meanSquaredError", model.getMeanSquaredError());
        out.put("rootMeanSquaredError", model.getRootMeanSquaredError());
        out.put("deviance", model.getDeviance());
        out.put("logLikelihood", model.getLogLikelihood());
        out.put("iterations", model.getIterations());
        out.put("converged", model.isConverged());
        out.put("fitted", model.getFittedValues());
        return out;
    }

    private static Map<String, Object> error(String type, String message) {
        log.debug("Fit request rejected ({}): {}", type, message);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message != null && !message.isEmpty() ? message : type);
        out.put("type", type);
        return out;
    }

    public String toJson(Object body) {
        return GSON.toJson(body);
    }
}
