import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

public final class FileUtils {
    private FileUtils(){}

    //Opens location from the classpath, falling back to the file system
    public static InputStream openLocation(String location) throws IOException {
        InputStream inputStream = FileUtils.class.getClassLoader().getResourceAsStream(location);
        if (inputStream != null) {
            return inputStream;
        }
        Path path = Path.of(location);
        if (Files.isReadable(path)) {
            return new FileInputStream(path.toFile());
        }
        throw new IOException(location + " was not found on the classpath or file system.");
    }

    public static Properties readProperties(String location) {
        Properties properties = new Properties();
        try (InputStream inputStream = openLocation(location)) {
            properties.load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ReferenceDataException("Unable to read " + location, e);
        }
        return properties;
    }

    //Gets headings of CSV
    public static List<String> getCSVHeadings(String location) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(openLocation(location), StandardCharsets.UTF_8))) {
            String headingLine = reader.readLine();
            if (headingLine == null) {
                throw new ReferenceDataException(location + " is empty");
            }
            return new ArrayList<>(Arrays.asList(headingLine.trim().split(",")));
        } catch (IOException e) {
            throw new ReferenceDataException("Unable to read " + location, e);
        }
    }

    //Rows of CSV less the heading row, blank lines skipped
    public static List<String[]> getCSVRows(String location) {
        List<String[]> rows = new ArrayList<>();
        String currentLine;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(openLocation(location), StandardCharsets.UTF_8))) {
            if (reader.readLine() == null) {
                throw new ReferenceDataException(location + " is empty");
            }
            while ((currentLine = reader.readLine()) != null) {
                if (currentLine.isBlank()) continue;
                String[] values = currentLine.split(",");
                for (int i = 0; i < values.length; i++) {
                    values[i] = values[i].trim();
                }
                rows.add(values);
            }
        } catch (IOException e) {
            throw new ReferenceDataException("Unable to read " + location, e);
        }
        return rows;
    }

    //Reads age group like "20-24", "7" or "80+" and outputs lower and upper age bound, open groups end at openGroupUpperAge
    public static int[] parseAgeGroup(String ageGroup, int openGroupUpperAge) {
        String trimmed = ageGroup.trim();
        try {
            if (trimmed.endsWith("+")) {
                int lowerAge = Integer.parseInt(trimmed.substring(0, trimmed.length() - 1));
                return new int[]{lowerAge, openGroupUpperAge};
            }
            String[] bounds = trimmed.split("-");
            int lowerAge = Integer.parseInt(bounds[0]);
            int upperAge = bounds.length > 1 ? Integer.parseInt(bounds[1]) : lowerAge;
            if (upperAge < lowerAge) {
                throw new ReferenceDataException("Age group " + ageGroup + " has upper bound below lower bound");
            }
            return new int[]{lowerAge, upperAge};
        } catch (NumberFormatException e) {
            throw new ReferenceDataException("Unable to parse age group " + ageGroup, e);
        }
    }

    public static double parseDouble(String value, String location) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ReferenceDataException("Malformed number " + value + " in " + location, e);
        }
    }

    public static long parseLong(String value, String location) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ReferenceDataException("Malformed integer " + value + " in " + location, e);
        }
    }
}
