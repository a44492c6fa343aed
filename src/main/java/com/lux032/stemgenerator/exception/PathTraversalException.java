package com.lux032.stemgenerator.exception;

import java.nio.file.Path;

/**
 * 路径解析后逃逸出允许的根目录
 */
public class PathTraversalException extends StemGeneratorException {

    public PathTraversalException(Path path, Path root) {
        super("Path " + path + " resolves outside of " + root);
    }
}
