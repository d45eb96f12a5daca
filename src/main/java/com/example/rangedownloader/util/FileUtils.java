package com.example.rangedownloader.util;

import java.io.File;
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.util.function.Predicate;

/**
 * 文件工具类
 * <p>
 * 提供文件名提取、清理和唯一性保证的相关功能
 * </p>
 */
public class FileUtils {

    public static final String DEFAULT_FILE_NAME = "download.dat";

    private FileUtils() {
    }

    /**
     * 从URL中提取文件名，如果不存在则返回默认名称
     *
     * @param originalUrl 原始下载URL
     * @return 提取的文件名
     */
    public static String extractFileNameFromUrl(String originalUrl) {
        String decodedUrl;
        try {
            // URL解码，处理中文等特殊字符
            decodedUrl = URLDecoder.decode(originalUrl, "UTF-8");
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            decodedUrl = originalUrl;
        }

        // 去掉可能的URL参数和锚点
        int cut = indexOfAny(decodedUrl, '?', '#');
        if (cut >= 0) {
            decodedUrl = decodedUrl.substring(0, cut);
        }

        int lastSlashIndex = decodedUrl.lastIndexOf('/');
        if (lastSlashIndex >= 0 && lastSlashIndex < decodedUrl.length() - 1) {
            String fileName = sanitize(decodedUrl.substring(lastSlashIndex + 1));
            // 排除 "http://example.com" 这类只有主机名的情况
            if (!fileName.isEmpty() && !decodedUrl.substring(0, lastSlashIndex).endsWith("/")) {
                return fileName;
            }
        }
        return DEFAULT_FILE_NAME;
    }

    /**
     * 从 Content-Disposition 中提取文件名
     * <p>
     * 支持 {@code filename="a.zip"} 和 {@code filename*=UTF-8''a.zip}，后者优先
     * </p>
     *
     * @return 文件名，没有时返回 null
     */
    public static String fileNameFromDisposition(String disposition) {
        if (disposition == null) {
            return null;
        }
        String plain = null;
        String extended = null;
        for (String part : disposition.split(";")) {
            String item = part.trim();
            String lower = item.toLowerCase();
            if (lower.startsWith("filename*=")) {
                String value = item.substring("filename*=".length()).trim();
                int quote = value.indexOf("''");
                String charset = quote > 0 ? value.substring(0, quote) : "UTF-8";
                String encoded = quote >= 0 ? value.substring(quote + 2) : value;
                try {
                    extended = URLDecoder.decode(trimQuotes(encoded), charset);
                } catch (UnsupportedEncodingException | IllegalArgumentException e) {
                    extended = trimQuotes(encoded);
                }
            } else if (lower.startsWith("filename=")) {
                plain = trimQuotes(item.substring("filename=".length()).trim());
            }
        }
        String name = sanitize(extended != null ? extended : plain);
        return name.isEmpty() ? null : name;
    }

    /**
     * 去掉路径分隔符和各系统不允许的字符
     */
    public static String sanitize(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = name.replaceAll("[\\x00-\\x1f<>:\"|?*]", "_").trim();
        if (name.equals(".") || name.equals("..")) {
            return "";
        }
        return name;
    }

    /**
     * 获取不重复的文件名
     * <p>
     * 如果文件名已存在（包括未完成的 .part 文件），则自动添加序号后缀
     * 例如: test.zip -> test(1).zip -> test(2).zip
     * </p>
     *
     * @param savePath 保存目录路径
     * @param fileName 期望的文件名
     * @return 唯一的文件名
     */
    public static String getUniqueFileName(String savePath, String fileName) {
        return getUniqueFileName(savePath, fileName, name -> false);
    }

    /**
     * 同 {@link #getUniqueFileName(String, String)}，另外跳过 reserved 判定为已占用的文件名
     */
    public static String getUniqueFileName(String savePath, String fileName, Predicate<String> reserved) {
        if (!taken(savePath, fileName) && !reserved.test(fileName)) {
            return fileName;
        }

        // 分离文件名主体和后缀
        String nameBody;
        String extension;
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex > 0) {
            nameBody = fileName.substring(0, dotIndex);
            extension = fileName.substring(dotIndex);
        } else {
            nameBody = fileName;
            extension = "";
        }

        // 递增序号直到找到不存在的文件名
        int counter = 1;
        while (true) {
            String newName = nameBody + "(" + counter + ")" + extension;
            if (!taken(savePath, newName) && !reserved.test(newName)) {
                return newName;
            }
            counter++;
        }
    }

    private static boolean taken(String savePath, String fileName) {
        return new File(savePath, fileName).exists() || new File(savePath, fileName + ".part").exists();
    }

    private static String trimQuotes(String value) {
        String v = value.trim();
        if (v.length() >= 2 && (v.startsWith("\"") && v.endsWith("\"") || v.startsWith("'") && v.endsWith("'"))) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) {
            return j;
        }
        return j < 0 ? i : Math.min(i, j);
    }
}
