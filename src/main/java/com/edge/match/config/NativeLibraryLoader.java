package com.edge.match.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenCV native 库加载
 * <p>
 * 使用 openpnp 打包的 native 库，进程内只加载一次
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 必须在任何 OpenCV 调用之前执行
     *
     * @return 是否加载成功
     */
    public static synchronized boolean loadNativeLibraries() {
        if (loaded) {
            return true;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            logger.info("OpenCV loaded successfully via openpnp");
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            // 没有 OpenCV 时只影响图像检测接口，引擎其余部分可用
            logger.warn("Failed to load OpenCV via openpnp, frame decoding disabled: {}", e.getMessage());
        }
        return loaded;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
