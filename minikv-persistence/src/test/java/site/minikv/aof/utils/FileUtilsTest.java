package site.minikv.aof.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("文件工具类测试")
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("创建缺失的父目录和文件")
    void createsParentDirectories() throws IOException {
        final Path file = tempDir.resolve("a/b/data.aof");
        try (FileChannel channel = FileUtils.openAppendChannel(file)) {
            assertThat(channel.size()).isZero();
        }
        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    @DisplayName("写入总是追加到已有内容之后")
    void appendsToExistingContent() throws IOException {
        final Path file = tempDir.resolve("data.aof");
        Files.write(file, "abc".getBytes(StandardCharsets.UTF_8));

        try (FileChannel channel = FileUtils.openAppendChannel(file)) {
            channel.write(ByteBuffer.wrap("def".getBytes(StandardCharsets.UTF_8)));
        }
        assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).isEqualTo("abcdef");
    }

    @Test
    @DisplayName("null路径被拒绝")
    void nullPath() {
        assertThatThrownBy(() -> FileUtils.openAppendChannel(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
