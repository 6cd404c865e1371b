package com.vidnyan.helio.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for finding extractable source files under a directory.
 */
public interface SourceTreeWalker {

    List<Path> collect(Path root) throws IOException;
}
