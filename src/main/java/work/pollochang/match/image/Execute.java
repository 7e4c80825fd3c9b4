package work.pollochang.match.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;
import work.pollochang.match.image.capture.RobotScreenCapture;
import work.pollochang.match.image.capture.ScreenCaptureProvider;
import work.pollochang.match.image.core.ImageMatcher;
import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.core.ImageResources;
import work.pollochang.match.image.core.MatchConfig;
import work.pollochang.match.image.core.Region;
import work.pollochang.match.image.exception.ImageMatchException;
import work.pollochang.match.image.exception.MatchCancelledException;
import work.pollochang.match.image.exception.MatchTimeoutException;
import work.pollochang.match.image.poll.PollController;
import work.pollochang.match.image.poll.PollState;
import work.pollochang.match.image.poll.WaitOptions;
import work.pollochang.match.image.report.MatchReport;
import work.pollochang.match.image.report.MatchResult;
import work.pollochang.match.image.tools.ConfigTools;
import work.pollochang.match.image.tools.FileTools;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-match",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "在螢幕或圖片中尋找樣板影像")
public class Execute implements Callable<Integer> {

    static final int EXIT_FOUND = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_ERROR = 2;

    static final String OUTCOME_NOT_FOUND = "NOT_FOUND";

    @Option(names = {"-t", "--template"}, required = true, description = "樣板圖片檔案。")
    private File template;

    @Option(names = {"-s", "--source"}, description = "要搜尋的圖片檔案，省略時擷取目前螢幕。")
    private File source;

    @Option(names = {"-r", "--region"}, converter = RegionConverter.class, description = "搜尋區域 x,y,w,h (預設: 整張畫面)。")
    private Region region;

    @Option(names = {"--config"}, description = "JSON 格式的比對參數檔，命令列選項會覆蓋其中的值。")
    private File configFile;

    @Option(names = {"-c", "--confidence"}, description = "最低信心分數，範圍 0.0 ~ 1.0 (預設: 0.8)。")
    private Double confidence;

    @Option(names = {"-l", "--limit"}, description = "最多回傳幾筆結果 (預設: 100)。")
    private Integer limit;

    @Option(names = {"--grayscale"}, description = "先轉為灰階再比對。")
    private boolean grayscale;

    @Option(names = {"--single-scale"}, description = "只用原始尺寸比對，不做多尺度搜尋。")
    private boolean singleScale;

    @Option(names = {"--scales"}, split = ",", description = "樣板縮放比例清單，例如 1.0,0.9,0.8。")
    private List<Double> scales;

    @Option(names = {"-a", "--all"}, description = "回傳所有結果，而不只是最佳的一筆。")
    private boolean all;

    @Option(names = {"--wait"}, description = "反覆搜尋直到樣板出現。")
    private boolean waitFor;

    @Option(names = {"--wait-gone"}, description = "反覆搜尋直到樣板消失。")
    private boolean waitForGone;

    @Option(names = {"--interval"}, defaultValue = "100", description = "輪詢間隔 (毫秒) (預設: 100)。")
    private long pollIntervalMs;

    @Option(names = {"--timeout"}, defaultValue = "10000", description = "最長等待時間 (毫秒) (預設: 10000)。")
    private long timeoutMs;

    @Option(names = {"-o", "--output"}, description = "JSON 報告輸出檔案 (預設: 標準輸出)。")
    private File output;

    @Option(names = {"--dump-config"}, description = "把實際使用的比對參數寫成 JSON 檔。")
    private File dumpConfig;

    @Override
    public Integer call() {
        long start = System.currentTimeMillis();
        String mode = waitForGone ? "wait-gone" : waitFor ? "wait" : all ? "find-all" : "find";
        String sourceName = source != null ? source.getPath() : "screen";

        log.info("========================================比對參數設定========================================");
        log.info("樣板: {}", template.getAbsolutePath());
        log.info("畫面來源: {}", sourceName);
        log.info("搜尋區域: {}", region != null ? region : "整張畫面");
        log.info("執行模式: {}", mode);
        log.info("========================================比對參數設定========================================");

        String outcome;
        List<MatchResult> matches = new ArrayList<>();
        int exitCode;
        try {
            if (waitFor && waitForGone) {
                throw new ImageMatchException("--wait 與 --wait-gone 不可同時使用");
            }
            MatchConfig config = resolveConfig();
            if (dumpConfig != null) {
                ConfigTools.saveMatchConfig(dumpConfig.toPath(), config);
            }
            ImageResource templateImage = ImageResources.imageResourceSync(template.toPath());
            ScreenCaptureProvider capture = captureProvider();

            if (waitFor || waitForGone) {
                WaitOptions options = WaitOptions.defaults()
                        .withRegion(region)
                        .withConfig(config)
                        .withPollIntervalMs(pollIntervalMs)
                        .withTimeoutMs(timeoutMs);
                PollController controller = new PollController(capture);
                if (waitFor) {
                    matches.add(controller.waitFor(templateImage, options));
                } else {
                    controller.waitForGone(templateImage, options);
                }
                outcome = PollState.FOUND.name();
            } else {
                ImageResource haystack = capture.captureScreen();
                Region searchRegion = region != null ? region : Region.of(haystack);
                if (all) {
                    matches.addAll(ImageMatcher.findAllInRegion(haystack, templateImage, searchRegion, config));
                } else {
                    Optional<MatchResult> best = ImageMatcher.findInRegion(haystack, templateImage, searchRegion, config);
                    best.ifPresent(matches::add);
                }
                outcome = matches.isEmpty() ? OUTCOME_NOT_FOUND : PollState.FOUND.name();
            }
            exitCode = matches.isEmpty() && !waitForGone ? EXIT_NOT_FOUND : EXIT_FOUND;
        } catch (MatchTimeoutException e) {
            log.warn("{}", e.getMessage());
            outcome = PollState.TIMED_OUT.name();
            exitCode = EXIT_NOT_FOUND;
        } catch (MatchCancelledException e) {
            log.warn("{}", e.getMessage());
            outcome = PollState.CANCELLED.name();
            exitCode = EXIT_NOT_FOUND;
        } catch (ImageMatchException e) {
            log.error("比對失敗: {}", e.getMessage(), e);
            return EXIT_ERROR;
        } catch (IOException e) {
            log.error("讀取或寫入檔案失敗: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }

        long elapsed = System.currentTimeMillis() - start;
        List<MatchReport.Entry> entries = matches.stream().map(MatchReport.Entry::of).toList();
        MatchReport report = new MatchReport(template.getPath(), sourceName, mode, outcome, entries, elapsed);
        try {
            writeReport(report);
        } catch (IOException e) {
            log.error("寫入報告失敗: {}", output, e);
            return EXIT_ERROR;
        }
        log.info("比對結束: {}，{} 筆結果，耗時 {} ms", outcome, matches.size(), elapsed);
        return exitCode;
    }

    /**
     * 設定檔 (或預設值) 加上命令列覆蓋的值。
     */
    private MatchConfig resolveConfig() {
        MatchConfig config = configFile != null
                ? ConfigTools.loadMatchConfig(configFile.toPath())
                : MatchConfig.defaults();
        if (confidence != null) {
            config = config.withConfidence(confidence);
        }
        if (limit != null) {
            config = config.withLimit(limit);
        }
        if (grayscale) {
            config = config.withUseGrayscale(true);
        }
        if (singleScale) {
            config = config.withSearchMultipleScales(false);
        }
        if (scales != null && !scales.isEmpty()) {
            config = config.withScaleSteps(scales);
        }
        config.validate();
        return config;
    }

    private ScreenCaptureProvider captureProvider() throws IOException {
        if (source == null) {
            return new RobotScreenCapture();
        }
        ImageResource haystack = ImageResources.imageResourceSync(source.toPath());
        return () -> haystack;
    }

    private void writeReport(MatchReport report) throws IOException {
        if (output == null) {
            System.out.println(ConfigTools.newMapper().writeValueAsString(report));
            return;
        }
        FileTools.ensureParentExists(output.toPath());
        ConfigTools.newMapper().writeValue(output, report);
        log.info("報告已寫入 {}", output.getAbsolutePath());
    }

    public static class RegionConverter implements ITypeConverter<Region> {
        @Override
        public Region convert(String value) {
            String[] parts = value.split(",");
            if (parts.length != 4) {
                throw new TypeConversionException("搜尋區域格式應為 x,y,w,h: " + value);
            }
            try {
                return new Region(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                        Integer.parseInt(parts[2].trim()), Integer.parseInt(parts[3].trim()));
            } catch (NumberFormatException e) {
                throw new TypeConversionException("搜尋區域必須是整數 x,y,w,h: " + value);
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
