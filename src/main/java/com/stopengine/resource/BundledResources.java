package com.stopengine.resource;

import com.stopengine.config.Constants;
import com.stopengine.error.ErrorKind;
import com.stopengine.error.MetadataSchemaException;
import com.stopengine.error.StopwordException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 定位随 classpath 分发的内置停用词元数据。
 * 
 * 打包在 jar 中时以 zip 文件系统打开，使路径约束检查仍基于 Path 进行。
 */
public final class BundledResources {

    private BundledResources() {
    }

    public static synchronized Path metadataPath() {
        URL url = BundledResources.class.getClassLoader().getResource(Constants.BUNDLED_METADATA_LOCATION);
        if (url == null) {
            throw new MetadataSchemaException(
                "Bundled stopword metadata '" + Constants.BUNDLED_METADATA_LOCATION + "' not found on classpath.");
        }
        try {
            URI uri = url.toURI();
            if ("jar".equals(uri.getScheme())) {
                openJarFileSystem(uri);
            }
            return Paths.get(uri);
        } catch (URISyntaxException | IOException exception) {
            throw new StopwordException(ErrorKind.IO, "Failed to locate bundled stopword metadata: " + url, exception);
        }
    }

    private static void openJarFileSystem(URI uri) throws IOException {
        try {
            FileSystems.getFileSystem(uri);
        } catch (FileSystemNotFoundException notOpened) {
            FileSystems.newFileSystem(uri, Map.of());
        }
    }
}
