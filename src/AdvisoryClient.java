import com.jsoniter.JsonIterator;
import com.jsoniter.ValueType;
import com.jsoniter.any.Any;
import com.jsoniter.output.JsonStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;

//Asks a generative text service to narrate one projected year, never fails the caller
public class AdvisoryClient {
    private static final Logger logger = LoggerFactory.getLogger(AdvisoryClient.class);

    public static final String DEFAULT_CONFIGURATION = "advisory.properties";
    public static final String EMPTY_ANALYSIS = "Unable to generate analysis.";
    public static final String UNAVAILABLE_ANALYSIS = "Analysis unavailable due to API error.";

    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int timeoutMillis;
    private final String country;

    public AdvisoryClient(String endpoint, String model, String apiKey, int timeoutMillis, String country) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.timeoutMillis = timeoutMillis;
        this.country = country;
    }

    //Endpoint settings from the configuration file, API key from the environment variable it names
    public static AdvisoryClient fromConfiguration(String location) {
        Properties properties = FileUtils.readProperties(location);
        String keyVariable = properties.getProperty("advisory.key.variable", "API_KEY").trim();
        return new AdvisoryClient(
                properties.getProperty("advisory.endpoint", "").trim(),
                properties.getProperty("advisory.model", "").trim(),
                System.getenv(keyVariable),
                (int) FileUtils.parseLong(properties.getProperty("advisory.timeout.millis", "15000").trim(), location),
                properties.getProperty("advisory.country", "Portugal").trim());
    }

    public String analyze(YearRecord yearRecord, SimulationParameters parameters) {
        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("No API key configured for advisory service at {}", endpoint);
            return UNAVAILABLE_ANALYSIS;
        }
        String prompt = buildPrompt(yearRecord, parameters, country);
        String body = "{\"contents\":[{\"parts\":[{\"text\":" + JsonStream.serialize(prompt) + "}]}]}";
        HttpURLConnection conn = null;
        try {
            URL url = new URL(endpoint + "/" + model + ":generateContent?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
            conn = (HttpURLConnection) url.openConnection();
            conn.setRequestMethod("POST");
            conn.setConnectTimeout(timeoutMillis);
            conn.setReadTimeout(timeoutMillis);
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json; charset=utf-8");
            try (OutputStream outputStream = conn.getOutputStream()) {
                outputStream.write(body.getBytes(StandardCharsets.UTF_8));
            }
            int responseCode = conn.getResponseCode();
            if (responseCode != 200) {
                logger.warn("Advisory service returned HTTP {} for year {}", responseCode, yearRecord.year());
                return UNAVAILABLE_ANALYSIS;
            }
            String response;
            try (InputStream inputStream = conn.getInputStream()) {
                response = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
            return extractText(response);
        } catch (IOException | RuntimeException e) {
            logger.warn("Advisory service call failed for year {}: {}", yearRecord.year(), e.toString());
            return UNAVAILABLE_ANALYSIS;
        } finally {
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    //First candidate's text, or the empty-analysis message when there is none
    static String extractText(String response) {
        Any jsonObject = JsonIterator.deserialize(response);
        Any text = jsonObject.get("candidates", 0, "content", "parts", 0, "text");
        if (text.valueType() != ValueType.STRING || text.toString().isBlank()) {
            return EMPTY_ANALYSIS;
        }
        return text.toString().trim();
    }

    public static String buildPrompt(YearRecord yearRecord, SimulationParameters parameters, String country) {
        EconomicMetrics economic = yearRecord.economic();
        StringBuilder prompt = new StringBuilder();
        prompt.append("Act as a senior demographic and economic policy expert for ").append(country).append(".\n");
        prompt.append("Analyze the following simulated demographic scenario for ").append(country)
                .append(" in the year ").append(yearRecord.year()).append(".\n\n");
        prompt.append("Simulation Parameters:\n");
        prompt.append("- Retirement Age: ").append(parameters.retirementAge()).append('\n');
        prompt.append("- Fertility Rate: ").append(format("%.2f", parameters.fertilityRate())).append('\n');
        prompt.append("- Net Migration: ").append(parameters.netMigration()).append(" / year\n");
        prompt.append("- Mortality Improvement: ").append(format("%.1f%% male, %.1f%% female",
                parameters.mortalityImprovement().male() * 100, parameters.mortalityImprovement().female() * 100)).append(" / year\n");
        prompt.append("- Workforce Entry Age Shift: ").append(parameters.workforceEntryAgeShift()).append(" years\n");
        prompt.append("- Unemployment Adjustment: ").append(format("%+.0f%%", parameters.unemploymentAdjustment() * 100)).append("\n\n");
        prompt.append("Current Stats:\n");
        prompt.append("- Total Population: ").append(format("%.2f", yearRecord.totalPopulation() / 1e6)).append(" Million\n");
        prompt.append("- Old-Age Dependency Ratio: ").append(format("%.1f", yearRecord.oldAgeDependencyRatio())).append("% (Retirees per 100 workers)\n");
        prompt.append("- Median Age: ").append(yearRecord.medianAge()).append('\n');
        prompt.append("- Retired Population: ").append(format("%.2f", yearRecord.retiredPopulation() / 1e6)).append(" Million\n");
        prompt.append("- Working Population: ").append(format("%.2f", yearRecord.workingAgePopulation() / 1e6)).append(" Million\n");
        prompt.append("- Social Security Balance: ").append(format("%.1f", economic.ssBalance() / 1e9)).append(" Billion EUR\n");
        prompt.append("- Sustainability Index: ").append(format("%.0f", economic.sustainabilityIndex())).append(" / 100\n\n");
        prompt.append("Provide a concise, 3-sentence high-level summary of the societal and economic mood.\n");
        prompt.append("Then, provide 3 bullet points on the specific pressure points for the economy ")
                .append("(Social Security sustainability, Healthcare burden, Labor shortage, etc.).\n");
        prompt.append("Be realistic about the consequences of such a high dependency ratio if it is high (>50%).");
        return prompt.toString();
    }

    private static String format(String pattern, Object... values) {
        return String.format(Locale.ROOT, pattern, values);
    }
}
