package work.pollochang.match.image.exception;

/**
 * 在找到結果或逾時之前，呼叫端已要求取消等待。
 */
public class MatchCancelledException extends ImageMatchException {

    public MatchCancelledException(String message) {
        super(message);
    }
}
