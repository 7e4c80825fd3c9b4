package work.pollochang.match.image.exception;

import lombok.Getter;

/**
 * 等待樣板出現 (或消失) 超過時限。
 */
@Getter
public class MatchTimeoutException extends ImageMatchException {

    private final long timeoutMs;

    public MatchTimeoutException(String message, long timeoutMs) {
        super(message);
        this.timeoutMs = timeoutMs;
    }
}
