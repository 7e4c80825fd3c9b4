package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;

/**
 * 載入 OpenCV 原生函式庫，並在樣本平面與 {@link Mat} 之間轉換。
 * 轉出的 Mat 一律為 32 位元浮點數、每個平面一個通道，使用完畢須由呼叫端 {@code release()}。
 */
@Slf4j
final class OpenCvSupport {

    private static boolean loaded;

    private OpenCvSupport() {}

    static synchronized void ensureLoaded() {
        if (!loaded) {
            OpenCV.loadLocally();
            loaded = true;
            log.debug("已載入 OpenCV {}", Core.VERSION);
        }
    }

    static Mat toMat(SampleImage image) {
        ensureLoaded();
        List<Mat> channels = new ArrayList<>(image.planes().length);
        for (int[] plane : image.planes()) {
            float[] values = new float[plane.length];
            for (int i = 0; i < plane.length; i++) {
                values[i] = plane[i];
            }
            channels.add(floatMat(image.width(), image.height(), values));
        }
        return merge(channels);
    }

    static Mat toMat(int width, int height, double[][] planes) {
        ensureLoaded();
        List<Mat> channels = new ArrayList<>(planes.length);
        for (double[] plane : planes) {
            float[] values = new float[plane.length];
            for (int i = 0; i < plane.length; i++) {
                values[i] = (float) plane[i];
            }
            channels.add(floatMat(width, height, values));
        }
        return merge(channels);
    }

    /**
     * 把 32 位元浮點數 Mat 拆回 row-major 的平面。
     */
    static double[][] toPlanes(Mat mat) {
        List<Mat> channels = new ArrayList<>(mat.channels());
        Core.split(mat, channels);
        try {
            double[][] planes = new double[channels.size()][];
            for (int c = 0; c < planes.length; c++) {
                planes[c] = values(channels.get(c));
            }
            return planes;
        } finally {
            channels.forEach(Mat::release);
        }
    }

    /**
     * 單通道 32 位元浮點數 Mat 的所有值。
     */
    static double[] values(Mat mat) {
        float[] values = new float[(int) mat.total()];
        mat.get(0, 0, values);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i];
        }
        return out;
    }

    private static Mat floatMat(int width, int height, float[] values) {
        Mat mat = new Mat(height, width, CvType.CV_32FC1);
        mat.put(0, 0, values);
        return mat;
    }

    private static Mat merge(List<Mat> channels) {
        if (channels.size() == 1) {
            return channels.get(0);
        }
        Mat merged = new Mat();
        try {
            Core.merge(channels, merged);
        } finally {
            channels.forEach(Mat::release);
        }
        return merged;
    }
}
