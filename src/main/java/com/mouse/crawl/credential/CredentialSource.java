package com.mouse.crawl.credential;

import java.nio.file.Path;

/**
 * Reads one identity's cookie set from disk.
 * Implementations fail closed: malformed input raises a configuration error instead of yielding partial cookies.
 */
public interface CredentialSource {

    LoadedCredentials loadCredentials(Path path);

    /** File name pattern understood by this source, e.g. {@code *.json}. */
    String fileGlob();
}
