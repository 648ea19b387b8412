package site.minikv.aof.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Set;

/**
 * 文件操作工具类
 *
 * <p>线程安全性：此类中的方法不持有状态，可以并发调用。
 *
 * @since 1.0.0
 */
@Slf4j
public final class FileUtils {

    /** 新建AOF文件的权限，实际权限还受进程umask影响 */
    public static final Set<PosixFilePermission> AOF_FILE_PERMISSIONS =
            PosixFilePermissions.fromString("rw-rw-rw-");

    private static final Set<StandardOpenOption> APPEND_OPTIONS = EnumSet.of(
            StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.APPEND);

    private FileUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 以读+追加模式打开文件，不存在时创建
     *
     * <p>父目录不存在时一并创建。文件系统支持POSIX属性时新文件权限为 rw-rw-rw-。
     *
     * @param path 文件路径，不能为null
     * @return 可读可追加的文件通道
     * @throws IOException 打开或创建失败时抛出
     */
    public static FileChannel openAppendChannel(final Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("文件路径不能为null");
        }

        // 1. 确保父目录存在
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
            log.debug("已创建目录: {}", parent);
        }

        // 2. 支持POSIX时带权限属性创建
        if (supportsPosix()) {
            final FileAttribute<Set<PosixFilePermission>> permissions =
                    PosixFilePermissions.asFileAttribute(AOF_FILE_PERMISSIONS);
            return FileChannel.open(path, APPEND_OPTIONS, permissions);
        }
        return FileChannel.open(path, APPEND_OPTIONS);
    }

    private static boolean supportsPosix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
}
