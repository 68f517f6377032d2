package com.example.imageboard.controller;

import com.example.imageboard.exception.NotFoundException;
import com.example.imageboard.service.MediaStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.PathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 附件预览接口：浏览器直接内联显示图片/视频
 */
@RestController
public class MediaController {

    @Autowired
    private MediaStore mediaStore;

    @GetMapping("/uploads/{filename:.+}")
    public ResponseEntity<Resource> preview(@PathVariable String filename) throws IOException {
        // 安全检查：防止路径遍历
        if (filename.contains("..") || filename.contains("/") || filename.contains("\\")) {
            return ResponseEntity.badRequest().build();
        }

        Path path = mediaStore.resolve(filename)
                .orElseThrow(() -> new NotFoundException("File not found: " + filename));

        // 先按文件内容探测类型，探测不到再按扩展名猜
        String contentType = Files.probeContentType(path);
        MediaType mediaType = contentType != null
                ? MediaType.parseMediaType(contentType)
                : MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                // inline 告诉浏览器直接显示，而不是下载
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + filename + "\"")
                .contentType(mediaType)
                .body(new PathResource(path));
    }
}
