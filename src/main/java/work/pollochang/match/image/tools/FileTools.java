package work.pollochang.match.image.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public class FileTools {

    /**
     * 寫入報告或設定檔前建立所需的上層目錄。
     *
     * @param file 即將寫入的檔案
     * @throws IOException 目錄無法建立，例如路徑中有同名的一般檔案
     */
    public static void ensureParentExists(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        Files.createDirectories(parent);
        log.info("已建立輸出目錄 {}", parent);
    }
}
