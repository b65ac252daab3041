package com.hting007.logiq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hting007.logiq.config.DetectionMode;
import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.detect.WindowAggregator;
import com.hting007.logiq.io.AnomalySink;
import com.hting007.logiq.io.InMemoryEventStore;
import com.hting007.logiq.io.Json;
import com.hting007.logiq.io.JsonLinesAnomalySink;
import com.hting007.logiq.io.LoggingAnomalySink;
import com.hting007.logiq.model.AnomalyKind;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.LogEvent;
import com.hting007.logiq.monitor.FileTailer;
import com.hting007.logiq.monitor.MonitorLoop;
import com.hting007.logiq.monitor.ReplayRunner;
import com.hting007.logiq.monitor.StreamMonitor;
import com.hting007.logiq.parse.LogLineTimestamps;
import com.hting007.logiq.parse.TemplateMiner;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@CommandLine.Command(
        name = "logiq",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        defaultValueProvider = CommandLine.PropertiesDefaultProvider.class,
        description = {
                "Mines log templates online and flags volume spikes and never-seen templates against a learned baseline.",
                "Option defaults may be set in ~/.logiq.properties using the option names in parentheses."
        }
)
public class Main implements Callable<Integer> {

    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Path to log file")
    private Path input;

    @CommandLine.Option(
            names = {"--follow"},
            description = "Tail the file and evaluate arriving lines live instead of replaying it"
    )
    private boolean follow;

    @CommandLine.Option(
            names = {"-w", "--window"}, descriptionKey = "windowSizeSeconds",
            description = "Window size in seconds (windowSizeSeconds, default: ${DEFAULT-VALUE})"
    )
    private int windowSeconds = 2;

    @CommandLine.Option(
            names = {"--poll"}, descriptionKey = "pollIntervalSeconds",
            description = "Poll interval in seconds for --follow (pollIntervalSeconds, default: ${DEFAULT-VALUE})"
    )
    private int pollSeconds = 2;

    @CommandLine.Option(
            names = {"--learning"}, descriptionKey = "learningWindowCount",
            description = "Non-empty windows learned before detecting (learningWindowCount, default: ${DEFAULT-VALUE})"
    )
    private int learningWindows = 5;

    @CommandLine.Option(
            names = {"--history"}, descriptionKey = "historyCapacity",
            description = "Windows kept in the rate baseline (historyCapacity, default: ${DEFAULT-VALUE})"
    )
    private int historyCapacity = 10;

    @CommandLine.Option(
            names = {"--lookback"}, descriptionKey = "lookbackSeconds",
            description = "Per-template history span in seconds (lookbackSeconds, default: ${DEFAULT-VALUE})"
    )
    private int lookbackSeconds = 120;

    @CommandLine.Option(
            names = {"-k", "--sigma"}, descriptionKey = "sigmaMultiplier",
            description = "Sigma multiplier of the threshold (sigmaMultiplier, default: ${DEFAULT-VALUE})"
    )
    private double sigma = 4.0;

    @CommandLine.Option(
            names = {"--std-floor"}, descriptionKey = "minStdFloorAbs",
            description = "Absolute standard deviation floor (minStdFloorAbs, default: ${DEFAULT-VALUE})"
    )
    private double stdFloorAbs = 1.0;

    @CommandLine.Option(
            names = {"--std-floor-ratio"}, descriptionKey = "minStdFloorRatio",
            description = "Standard deviation floor relative to the mean (minStdFloorRatio, default: ${DEFAULT-VALUE})"
    )
    private double stdFloorRatio = 0.05;

    @CommandLine.Option(
            names = {"--noise"}, descriptionKey = "noiseThresholdMean",
            description = "Per-template mean below which no spike is reported (noiseThresholdMean, default: ${DEFAULT-VALUE})"
    )
    private double noiseMean = 10.0;

    @CommandLine.Option(
            names = {"--depth"}, descriptionKey = "maxTreeDepth",
            description = "Template tree depth (maxTreeDepth, default: ${DEFAULT-VALUE})"
    )
    private int maxDepth = 5;

    @CommandLine.Option(
            names = {"-m", "--mode"}, descriptionKey = "templateSimilarityMode",
            description = "Frequency mode: global-rate or per-template (templateSimilarityMode, default: ${DEFAULT-VALUE})"
    )
    private String mode = "global-rate";

    @CommandLine.Option(
            names = {"--retries"}, descriptionKey = "retryMaxAttempts",
            description = "Attempts per source/sink call (retryMaxAttempts, default: ${DEFAULT-VALUE})"
    )
    private int retries = 3;

    @CommandLine.Option(
            names = {"--backoff-ms"}, descriptionKey = "retryBackoffMillis",
            description = "Backoff between attempts (retryBackoffMillis, default: ${DEFAULT-VALUE})"
    )
    private long backoffMillis = 500;

    @CommandLine.Option(
            names = {"--tz"},
            description = "IANA time zone for local timestamps (default: system zone)"
    )
    private String timeZoneId;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Report file path (default: stdout)"
    )
    private Path output;

    @CommandLine.Option(
            names = {"--anomalies"},
            description = "Append anomalies as JSON lines to this file (default: log them)"
    )
    private Path anomaliesFile;

    @CommandLine.Option(
            names = {"--format"},
            description = "Report format: text or json (default: ${DEFAULT-VALUE})"
    )
    private String format = "text";

    @CommandLine.Option(
            names = {"--stats"},
            description = "Include template statistics in the report"
    )
    private boolean stats;

    @CommandLine.Option(
            names = {"--topk"},
            description = "Max templates listed with --stats (default: ${DEFAULT-VALUE})"
    )
    private int topK = 10;

    private static final ObjectMapper MAPPER = Json.newMapper();

    @Override
    public Integer call() throws Exception {
        // basic validation
        if (!Files.exists(input) || !Files.isRegularFile(input)) {
            System.err.println("ERROR: input file not found: " + input);
            return 2;
        }
        if (topK < 1) {
            System.err.println("ERROR: --topk must be >= 1");
            return 2;
        }
        if (!format.equals("text") && !format.equals("json")) {
            System.err.println("ERROR: --format must be 'text' or 'json'");
            return 2;
        }

        DetectorConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        ZoneId zid;
        try {
            zid = (timeZoneId == null || timeZoneId.isBlank())
                    ? ZoneId.systemDefault()
                    : ZoneId.of(timeZoneId);
        } catch (DateTimeException e) {
            System.err.println("ERROR: invalid --tz value: " + timeZoneId);
            return 2;
        }

        TemplateMiner miner = new TemplateMiner(config.getMaxTreeDepth());
        AnomalySink sink = anomaliesFile == null ? new LoggingAnomalySink() : JsonLinesAnomalySink.open(anomaliesFile);
        try {
            return follow ? follow(config, miner, sink) : replay(config, miner, sink, zid);
        } finally {
            if (sink instanceof Closeable) ((Closeable) sink).close();
        }
    }

    DetectorConfig buildConfig() {
        return DetectorConfig.builder()
                .windowSizeSeconds(windowSeconds)
                .pollIntervalSeconds(pollSeconds)
                .learningWindowCount(learningWindows)
                .historyCapacity(historyCapacity)
                .lookbackSeconds(lookbackSeconds)
                .sigmaMultiplier(sigma)
                .minStdFloorAbs(stdFloorAbs)
                .minStdFloorRatio(stdFloorRatio)
                .noiseThresholdMean(noiseMean)
                .maxTreeDepth(maxDepth)
                .templateSimilarityMode(DetectionMode.parse(mode))
                .retryMaxAttempts(retries)
                .retryBackoffMillis(backoffMillis)
                .build()
                .validate();
    }

    private int replay(DetectorConfig config, TemplateMiner miner, AnomalySink sink, ZoneId zid) throws IOException {
        var aggregator = new WindowAggregator(config.getWindowSizeSeconds());
        var monitor = StreamMonitor.create(input.getFileName().toString(), config, sink, Clock.systemUTC());
        var runner = new ReplayRunner(miner, new LogLineTimestamps(zid), aggregator,
                config.getHistoryCapacity());

        ReplayRunner.Result result;
        try (BufferedReader br = Files.newBufferedReader(input)) {
            result = runner.run(br, monitor);
        }

        Map<String, Object> report = buildReport(config, miner, monitor, aggregator, result, zid);

        String out;
        if (format.equals("json")) {
            out = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } else {
            out = toTextReport(report);
        }

        if (output == null) {
            System.out.println(out);
        } else {
            Files.writeString(output, out);
        }

        return monitor.getDeliveryFailures() == 0 ? 0 : 1;
    }

    private int follow(DetectorConfig config, TemplateMiner miner, AnomalySink sink) throws InterruptedException {
        Clock clock = Clock.systemUTC();
        var retention = Duration.ofSeconds(Math.max(config.getLookbackSeconds(), 2L * config.getWindowSizeSeconds()));
        var store = new InMemoryEventStore(retention, clock);
        var monitor = StreamMonitor.create(input.getFileName().toString(), config, sink, clock);

        var tailer = new FileTailer(input, line -> store.append(LogEvent.of(clock.instant(), miner.parse(line))), 200);
        Thread tailThread = new Thread(tailer, "tail-" + input.getFileName());
        tailThread.setDaemon(true);

        CountDownLatch stopped = new CountDownLatch(1);
        MonitorLoop loop = MonitorLoop.create(monitor, store, config, clock);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            tailer.stop();
            loop.close();
            stopped.countDown();
        }, "logiq-shutdown"));

        tailThread.start();
        loop.start();
        stopped.await();
        return 0;
    }

    private Map<String, Object> buildReport(DetectorConfig config, TemplateMiner miner, StreamMonitor monitor,
                                            WindowAggregator aggregator, ReplayRunner.Result result, ZoneId zid) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("tool", "logiq");
        report.put("analysedAt", Instant.now());
        report.put("input", input.toString());

        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("templateSimilarityMode", config.getTemplateSimilarityMode());
        cfg.put("windowSizeSeconds", config.getWindowSizeSeconds());
        cfg.put("learningWindowCount", config.getLearningWindowCount());
        cfg.put("sigmaMultiplier", config.getSigmaMultiplier());
        cfg.put("minStdFloorAbs", config.getMinStdFloorAbs());
        cfg.put("minStdFloorRatio", config.getMinStdFloorRatio());
        cfg.put("noiseThresholdMean", config.getNoiseThresholdMean());
        cfg.put("maxTreeDepth", config.getMaxTreeDepth());
        report.put("config", cfg);

        long frequency = result.anomalies().stream().filter(a -> a.kind() == AnomalyKind.FREQUENCY).count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalLines", result.totalLines());
        summary.put("parsedLines", result.parsedLines());
        summary.put("skippedLines", result.skippedLines());
        summary.put("windows", result.windows());
        summary.put("templates", miner.getStats().size());
        summary.put("templateNodes", miner.getTemplateNodeCount());
        summary.put("baselinePhase", monitor.engine().baseline().phase());
        summary.put("anomalies", result.anomalies().size());
        summary.put("frequencyAnomalies", frequency);
        summary.put("patternAnomalies", result.anomalies().size() - frequency);
        summary.put("undelivered", monitor.getDeliveryFailures());
        report.put("summary", summary);

        List<Map<String, Object>> anomalies = new ArrayList<>();
        for (AnomalyRecord a : result.anomalies()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("kind", a.kind());
            m.put("windowStart", a.windowStart());
            m.put("windowStartLocal", a.windowStart().atZone(zid).toString());
            if (a.templateId() != null) m.put("templateId", a.templateId());
            m.put("observed", a.observed());
            m.put("threshold", round2(a.expected()));
            m.put("severity", round2(a.severity()));
            m.put("description", a.description());
            anomalies.add(m);
        }
        report.put("anomalies", anomalies);

        if (stats) {
            report.put("templates", topTemplates(miner.getStats()));
            report.put("templateWindows", templateWindows(aggregator, result));
        }
        return report;
    }

    private List<Map<String, Object>> topTemplates(Map<String, Long> stats) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(stats.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()));

        List<Map<String, Object>> out = new ArrayList<>();
        for (var e : entries.subList(0, Math.min(topK, entries.size()))) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("template", e.getKey());
            m.put("occurrences", e.getValue());
            out.add(m);
        }
        return out;
    }

    // busiest window per template over the replayed range
    private Map<String, Object> templateWindows(WindowAggregator aggregator, ReplayRunner.Result result) {
        Map<String, Long> peak = new TreeMap<>();
        Map<String, Integer> windows = new TreeMap<>();
        aggregator.countByTemplate(result.events()).forEach((wk, count) -> {
            peak.merge(wk.templateId(), count, Long::max);
            windows.merge(wk.templateId(), 1, Integer::sum);
        });

        Map<String, Object> out = new LinkedHashMap<>();
        for (String id : peak.keySet()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("windows", windows.get(id));
            m.put("peakCount", peak.get(id));
            out.put(id, m);
        }
        return out;
    }

    private static double round2(double x) {
        return Math.round(x * 100.0) / 100.0;
    }

    @SuppressWarnings("unchecked")
    private static String toTextReport(Map<String, Object> report) {
        Map<String, Object> summary = (Map<String, Object>) report.get("summary");
        List<Map<String, Object>> anomalies = (List<Map<String, Object>>) report.get("anomalies");
        Map<String, Object> cfg = (Map<String, Object>) report.get("config");

        StringBuilder sb = new StringBuilder();
        sb.append("logiq report\n");
        sb.append("input: ").append(report.get("input")).append("\n");
        sb.append("analysedAt: ").append(report.get("analysedAt")).append("\n");
        sb.append("config: mode=").append(cfg.get("templateSimilarityMode"))
                .append(" windowSizeSeconds=").append(cfg.get("windowSizeSeconds"))
                .append(" learningWindowCount=").append(cfg.get("learningWindowCount"))
                .append(" sigmaMultiplier=").append(cfg.get("sigmaMultiplier"))
                .append("\n");
        sb.append("summary: totalLines=").append(summary.get("totalLines"))
                .append(" parsedLines=").append(summary.get("parsedLines"))
                .append(" skippedLines=").append(summary.get("skippedLines"))
                .append(" windows=").append(summary.get("windows"))
                .append(" templates=").append(summary.get("templates"))
                .append(" baseline=").append(summary.get("baselinePhase"))
                .append(" anomalies=").append(summary.get("anomalies"))
                .append("\n");

        if (anomalies.isEmpty()) {
            sb.append("anomalies: none\n");
        } else {
            sb.append("anomalies:\n");
            for (var a : anomalies) {
                sb.append("- kind=").append(a.get("kind"))
                        .append(" windowStart=").append(a.get("windowStart"))
                        .append(" severity=").append(a.get("severity"))
                        .append(" ").append(a.get("description"))
                        .append("\n");
            }
        }

        if (report.containsKey("templates")) {
            List<Map<String, Object>> templates = (List<Map<String, Object>>) report.get("templates");
            sb.append("templates:\n");
            for (var t : templates) {
                sb.append(String.format("%8d  %s%n", (Long) t.get("occurrences"), t.get("template")));
            }
        }
        return sb.toString();
    }

    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
