package glm;

import glm.api.FitRequestHandler;
import glm.api.SampleData;
import glm.ml.IrlsSettings;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.staticfiles.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Web app for fitting generalized linear models over HTTP.
 * Run with: mvn exec:java -Dexec.mainClass="glm.WebApp"
 * Open http://localhost:7000 (or http://127.0.0.1:7000)
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring PORT={}: {}", env, e.getMessage());
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        IrlsSettings settings = IrlsSettings.fromEnvironment();
        FitRequestHandler handler = new FitRequestHandler(settings);
        log.info("IRLS settings: {}", settings);

        Javalin app = Javalin.create(cfg -> {
            cfg.staticFiles.add("/public", Location.CLASSPATH);
        }).start("0.0.0.0", port);

        // Serve index from classpath so it always works (avoids static path issues)
        app.get("/", ctx -> ctx.contentType("text/html").result(loadIndexHtml()));

        app.post("/api/fit", ctx -> sendJson(ctx, handler, handler.handle(ctx.body())));

        app.get("/api/sample", ctx -> {
            Map<String, Object> sample = new LinkedHashMap<>();
            sample.put("design", SampleData.design());
            sample.put("response", SampleData.response());
            sample.put("family", "poisson");
            sendJson(ctx, handler, sample);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", port);
            sendJson(ctx, handler, h);
        });

        log.info("GLM web app: http://localhost:{}", port);
    }

    private static void sendJson(Context ctx, FitRequestHandler handler, Object body) {
        ctx.status(200).contentType("application/json").result(handler.toJson(body));
    }

    private static String loadIndexHtml() {
        try (InputStream in = WebApp.class.getResourceAsStream("/public/index.html")) {
            if (in == null) throw new IllegalStateException("Missing /public/index.html on classpath");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new RuntimeException("Could not load index.html", e);
        }
    }
}
