package work.pollochang.match.image.report;

import java.util.List;

/**
 * 命令列輸出的 JSON 報告。
 *
 * @param template  樣板檔案
 * @param source    畫面來源 (檔案路徑或 "screen")
 * @param mode      執行模式
 * @param outcome   結果狀態
 * @param matches   比對結果，依信心分數由高到低
 * @param elapsedMs 耗時 (毫秒)
 */
public record MatchReport(String template, String source, String mode, String outcome,
                          List<Entry> matches, long elapsedMs) {

    public record Entry(MatchResult match, MatchPoint center) {

        public static Entry of(MatchResult match) {
            return new Entry(match, match.center());
        }
    }
}
