package io.scrapehive.scraper.parse;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the Prometheus text exposition format (version 0.0.4).
 * <p>
 * Counters, gauges and untyped samples become one metric each with a single field
 * ({@code counter}, {@code gauge} or {@code value}). Summary and histogram samples that share a
 * family and label set are folded into one metric whose fields are the quantiles or buckets plus
 * {@code sum} and {@code count}.
 */
public class TextExpositionParser implements ExpositionParser {

    static final String PROTOBUF_MEDIA_TYPE = "application/vnd.google.protobuf";

    private static final Pattern METRIC_LINE_PATTERN = Pattern.compile(
        "^([a-zA-Z_:][a-zA-Z0-9_:]*)(\\{(.*)\\})?\\s+(\\S+)(\\s+(-?\\d+))?$"
    );
    private static final Pattern LABEL_PATTERN = Pattern.compile(
        "\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*=\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*(,|$)"
    );
    private static final Pattern TYPE_COMMENT_PATTERN = Pattern.compile(
        "^#\\s*TYPE\\s+([a-zA-Z_:][a-zA-Z0-9_:]*)\\s+(\\w+)\\s*$"
    );

    private final Clock clock;

    public TextExpositionParser() {
        this(Clock.systemUTC());
    }

    public TextExpositionParser(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<ParsedMetric> parse(byte[] body, Map<String, List<String>> headers) throws ExpositionParseException {
        String contentType = firstHeader(headers, "content-type");
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(PROTOBUF_MEDIA_TYPE)) {
            throw new ExpositionParseException("unsupported content type " + contentType);
        }

        Instant now = clock.instant();
        Map<String, MetricKind> familyKinds = new HashMap<>();
        List<ParsedMetric> metrics = new ArrayList<>();
        // Summary and histogram samples are folded per family + label set, in first-seen order
        Map<String, ParsedMetric> folded = new LinkedHashMap<>();

        String[] lines = new String(body, StandardCharsets.UTF_8).split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("#")) {
                Matcher typeMatcher = TYPE_COMMENT_PATTERN.matcher(line);
                if (typeMatcher.matches()) {
                    familyKinds.put(typeMatcher.group(1), MetricKind.fromTypeName(typeMatcher.group(2)));
                }
                continue;
            }

            Matcher metricMatcher = METRIC_LINE_PATTERN.matcher(line);
            if (!metricMatcher.matches()) {
                throw new ExpositionParseException("line " + (i + 1) + ": malformed sample \"" + line + "\"");
            }
            String name = metricMatcher.group(1);
            Map<String, String> labels = parseLabels(metricMatcher.group(3), i + 1);
            double value = parseValue(metricMatcher.group(4), i + 1);
            Instant timestamp = metricMatcher.group(6) == null
                    ? now
                    : parseTimestamp(metricMatcher.group(6), i + 1);

            String family = familyName(name, familyKinds);
            MetricKind kind = familyKinds.getOrDefault(family, MetricKind.UNTYPED);
            switch (kind) {
                case COUNTER -> metrics.add(new ParsedMetric(name, kind, Map.of("counter", value), labels, timestamp));
                case GAUGE -> metrics.add(new ParsedMetric(name, kind, Map.of("gauge", value), labels, timestamp));
                case UNTYPED -> metrics.add(new ParsedMetric(name, kind, Map.of("value", value), labels, timestamp));
                case SUMMARY, HISTOGRAM -> fold(folded, family, kind, name, labels, value, timestamp);
            }
        }
        metrics.addAll(folded.values());
        return metrics;
    }

    private static void fold(Map<String, ParsedMetric> folded, String family, MetricKind kind, String name,
                             Map<String, String> labels, double value, Instant timestamp) {
        String bucketLabel = kind == MetricKind.HISTOGRAM ? "le" : "quantile";
        Map<String, String> groupLabels = new LinkedHashMap<>(labels);
        String bucket = groupLabels.remove(bucketLabel);

        String key = family + ":" + new TreeMap<>(groupLabels);
        ParsedMetric metric = folded.computeIfAbsent(key,
                k -> new ParsedMetric(family, kind, Map.of(), groupLabels, timestamp));

        if (name.equals(family + "_sum")) {
            metric.fields().put("sum", value);
        } else if (name.equals(family + "_count")) {
            metric.fields().put("count", value);
        } else if (bucket != null) {
            metric.fields().put(bucket, value);
        }
    }

    private static Map<String, String> parseLabels(String labelsStr, int lineNumber) throws ExpositionParseException {
        Map<String, String> labels = new LinkedHashMap<>();
        if (labelsStr == null || labelsStr.isBlank()) {
            return labels;
        }
        Matcher labelMatcher = LABEL_PATTERN.matcher(labelsStr);
        int consumed = 0;
        while (labelMatcher.find() && labelMatcher.start() == consumed) {
            labels.put(labelMatcher.group(1), unescape(labelMatcher.group(2)));
            consumed = labelMatcher.end();
        }
        if (consumed != labelsStr.length()) {
            throw new ExpositionParseException("line " + lineNumber + ": malformed labels {" + labelsStr + "}");
        }
        return labels;
    }

    private static double parseValue(String valueStr, int lineNumber) throws ExpositionParseException {
        switch (valueStr) {
            case "NaN":
                return Double.NaN;
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(valueStr);
                } catch (NumberFormatException e) {
                    throw new ExpositionParseException("line " + lineNumber + ": invalid value \"" + valueStr + "\"", e);
                }
        }
    }

    private static Instant parseTimestamp(String timestampStr, int lineNumber) throws ExpositionParseException {
        try {
            return Instant.ofEpochMilli(Long.parseLong(timestampStr));
        } catch (NumberFormatException e) {
            throw new ExpositionParseException("line " + lineNumber + ": invalid timestamp \"" + timestampStr + "\"", e);
        }
    }

    private static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                sb.append(next == 'n' ? '\n' : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Family of a sample name, resolving the histogram/summary/counter suffixes.
     */
    private static String familyName(String metricName, Map<String, MetricKind> familyKinds) {
        if (familyKinds.containsKey(metricName)) {
            return metricName;
        }
        String[] suffixes = {"_bucket", "_sum", "_count", "_total"};
        for (String suffix : suffixes) {
            if (metricName.endsWith(suffix)) {
                String baseName = metricName.substring(0, metricName.length() - suffix.length());
                if (familyKinds.containsKey(baseName)) {
                    return baseName;
                }
            }
        }
        return metricName;
    }

    static String firstHeader(Map<String, List<String>> headers, String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
