package work.pollochang.match.image.capture;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.match.image.core.ImageResource;
import work.pollochang.match.image.exception.CaptureException;
import work.pollochang.match.image.tools.ImageTools;

import java.awt.AWTException;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;

/**
 * 以 {@link Robot} 擷取主螢幕。
 */
@Slf4j
public class RobotScreenCapture implements ScreenCaptureProvider {

    private final Robot robot;

    public RobotScreenCapture() {
        if (GraphicsEnvironment.isHeadless()) {
            throw new CaptureException("目前為 headless 環境，無法擷取螢幕");
        }
        try {
            this.robot = new Robot();
        } catch (AWTException | SecurityException e) {
            throw new CaptureException("無法初始化螢幕擷取", e);
        }
    }

    @Override
    public ImageResource captureScreen() {
        Rectangle bounds = getScreenBounds();
        try {
            BufferedImage shot = robot.createScreenCapture(bounds);
            log.trace("已擷取螢幕 {}x{}", shot.getWidth(), shot.getHeight());
            return ImageTools.toImageResource(shot, null);
        } catch (RuntimeException e) {
            throw new CaptureException("擷取螢幕失敗: " + bounds, e);
        }
    }

    private Rectangle getScreenBounds() {
        Dimension d = Toolkit.getDefaultToolkit().getScreenSize();
        return new Rectangle(0, 0, d.width, d.height);
    }
}
