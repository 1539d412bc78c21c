package io.devhire.marketplace.task;

import java.util.UUID;

/** Released solution archive of a paid task. */
public record SolutionDownload(UUID taskId, String filename, byte[] content) {}
