package com.example.imageboard.service;

import com.example.imageboard.config.ImageboardProperties;
import com.example.imageboard.exception.MediaStorageException;
import com.example.imageboard.model.StoredMedia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 附件存储服务 (Media Store)
 * 作用：校验上传文件的扩展名，生成不会重名的存储文件名，把原始字节写进上传目录。
 * * 💡 规则：
 * 1. 只接受白名单里的扩展名 (png/jpg/jpeg/gif/webp/webm/mp4)，其余文件直接丢弃，帖子照常发出，只是没有附件。
 * 2. 存储名 = 12 位随机十六进制 + "." + 小写扩展名，所有文件平铺在同一个目录下。
 * 3. 不做任何转码，也不生成缩略图。
 */
@Service
public class MediaStore {

    private static final Logger log = LoggerFactory.getLogger(MediaStore.class);

    private static final int RANDOM_ID_LENGTH = 12;

    private final Path uploadDir;
    private final Set<String> allowedExtensions;

    public MediaStore(ImageboardProperties properties) {
        this.uploadDir = Paths.get(properties.getUploadDir()).toAbsolutePath().normalize();
        this.allowedExtensions = properties.getAllowedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        // 如果目录不存在，启动时自动创建
        try {
            Files.createDirectories(uploadDir);
        } catch (IOException e) {
            throw new MediaStorageException("Cannot create upload directory " + uploadDir, e);
        }
    }

    /**
     * 保存一个上传文件
     *
     * @param file 表单里的 file 字段，可以为 null
     * @return 保存结果；没有文件或扩展名不在白名单时返回 Optional.empty()
     * @throws MediaStorageException 写盘失败
     */
    public Optional<StoredMedia> store(MultipartFile file) {
        if (file == null || !StringUtils.hasText(file.getOriginalFilename())) {
            return Optional.empty();
        }
        String originalName = file.getOriginalFilename();
        String extension = extensionOf(originalName);
        if (extension == null || !allowedExtensions.contains(extension)) {
            log.debug("Rejected upload {}: extension not allowed", originalName);
            return Optional.empty();
        }

        String storedName = randomId() + "." + extension;
        Path target = uploadDir.resolve(storedName);
        try (InputStream is = file.getInputStream()) {
            Files.copy(is, target);
            long size = Files.size(target);

            String displayName = sanitizeFilename(originalName);
            if (displayName.isEmpty()) {
                displayName = storedName;
            }
            log.info("Stored upload {} as {} ({} bytes)", displayName, storedName, size);
            return Optional.of(new StoredMedia(storedName, displayName, size));
        } catch (IOException e) {
            throw new MediaStorageException("Failed to store upload " + storedName, e);
        }
    }

    /**
     * 根据存储名找到文件路径
     * 只接受本目录下的平铺文件名，带路径分隔符或 ".." 的一律拒绝。
     */
    public Optional<Path> resolve(String storedName) {
        if (!isSafeName(storedName)) {
            return Optional.empty();
        }
        Path path = uploadDir.resolve(storedName).normalize();
        if (!path.getParent().equals(uploadDir) || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(path);
    }

    /**
     * 删除已保存的附件
     * 用于帖子写库失败后清理孤儿文件，删除失败只记日志。
     */
    public void discard(StoredMedia media) {
        if (media == null) {
            return;
        }
        try {
            Files.deleteIfExists(uploadDir.resolve(media.getStoredName()));
            log.info("Discarded orphaned upload {}", media.getStoredName());
        } catch (IOException e) {
            log.warn("Could not delete orphaned upload {}", media.getStoredName(), e);
        }
    }

    public Path getUploadDir() {
        return uploadDir;
    }

    // ================== 文件名工具方法 ==================

    /**
     * 取最后一个 "." 之后的扩展名并转小写；没有扩展名返回 null
     */
    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return null;
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * 把用户给的文件名处理成可以安全展示的形式：
     * 去掉路径部分和非 ASCII 字符，空白换成下划线，只保留字母、数字、"_"、"."、"-"。
     * 例如 "../../etc/passwd" -> "etc_passwd"，"my cat.png" -> "my_cat.png"。
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return "";
        }
        String ascii = Normalizer.normalize(filename, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
        ascii = ascii.replace('/', ' ').replace('\\', ' ');
        String joined = String.join("_", ascii.trim().split("\\s+"));
        String cleaned = joined.replaceAll("[^A-Za-z0-9_.-]", "");
        return cleaned.replaceAll("^[._]+|[._]+$", "");
    }

    private static boolean isSafeName(String name) {
        return StringUtils.hasText(name)
                && !name.contains("..")
                && !name.contains("/")
                && !name.contains("\\");
    }

    private static String randomId() {
        // UUID.randomUUID() 基于 SecureRandom
        return UUID.randomUUID().toString().replace("-", "").substring(0, RANDOM_ID_LENGTH);
    }
}
