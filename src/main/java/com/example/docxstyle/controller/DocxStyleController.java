package com.example.docxstyle.controller;

import com.example.docxstyle.service.DocxStyleService;
import com.example.docxstyle.service.StyleProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * DOCX样式处理控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/docx-style")
public class DocxStyleController {

    @Autowired
    private DocxStyleService docxStyleService;

    /**
     * 对上传的DOCX应用样式定义，返回处理后的文档
     *
     * @param file     DOCX文件
     * @param styles   样式定义文档（可选，缺省使用配置的定义文件）
     * @param styleSet 要应用的样式集（可选）
     * @param mappings 样式映射JSON（可选）
     */
    @PostMapping("/apply")
    public ResponseEntity<?> applyStyles(@RequestParam("file") MultipartFile file,
                                         @RequestParam(value = "styles", required = false) MultipartFile styles,
                                         @RequestParam(value = "styleSet", required = false) String styleSet,
                                         @RequestParam(value = "mappings", required = false) String mappings) {
        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".docx")) {
            result.put("success", false);
            result.put("message", "只支持.docx文件");
            return ResponseEntity.badRequest().body(result);
        }

        try (InputStream in = file.getInputStream()) {
            String styleSheetXml = styles == null || styles.isEmpty()
                    ? null : new String(styles.getBytes(), StandardCharsets.UTF_8);
            byte[] output = docxStyleService.applyStyles(in, styleSheetXml, styleSet, mappings);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
            headers.setContentDispositionFormData("attachment", URLEncoder.encode(originalFilename, "UTF-8"));
            log.info("样式处理完成: file={}, styleSet={}, size={}", originalFilename, styleSet, output.length);
            return new ResponseEntity<>(output, headers, HttpStatus.OK);

        } catch (StyleProcessingException e) {
            log.warn("样式处理失败: file={}, error={}", originalFilename, e.getError());
            result.put("success", false);
            result.put("message", e.getMessage());
            result.put("code", e.getError().getCode());
            return ResponseEntity.badRequest().body(result);
        } catch (IOException e) {
            log.error("读取或写入DOCX失败: file={}, error={}", originalFilename, e.getMessage(), e);
            result.put("success", false);
            result.put("message", "文档处理失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 预览样式定义：解析并返回样式列表、样式集和生成的styles.xml
     *
     * @param styleSheetXml 样式定义文档
     */
    @PostMapping(value = "/preview", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Map<String, Object>> previewStyles(@RequestBody String styleSheetXml) {
        Map<String, Object> result = new HashMap<>();
        try {
            Map<String, Object> preview = docxStyleService.previewStyles(styleSheetXml);
            result.put("success", true);
            result.putAll(preview);
            return ResponseEntity.ok(result);
        } catch (StyleProcessingException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            result.put("code", e.getError().getCode());
            return ResponseEntity.badRequest().body(result);
        }
    }
}
