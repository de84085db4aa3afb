package com.stashguard.config;

import java.nio.file.Path;

/**
 * Deployment settings for one server process.
 *
 * @param bindHost interface the HTTP transport binds to
 * @param port HTTP port
 * @param storageDirectory root directory of the file-backed document store
 * @param tokensFile JSON token table used for identity verification
 */
public record ServiceConfig(String bindHost, int port, Path storageDirectory, Path tokensFile) {
}
