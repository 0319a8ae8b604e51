package com.stopengine.resource;

import java.nio.file.Path;

/**
 * 解析结果缓存键；大小写模式参与键值，两种模式互不共享。
 */
record ResolutionKey(Path metadataPath, String resourceName, boolean caseSensitive) {
}
