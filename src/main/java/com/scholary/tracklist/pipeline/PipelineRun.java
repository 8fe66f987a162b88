package com.scholary.tracklist.pipeline;

import com.scholary.tracklist.matching.Tracklist;

/**
 * Result of a pipeline run.
 *
 * @param partial true when the run was cancelled before every segment was processed
 */
public record PipelineRun(Tracklist tracklist, PipelineDiagnostics diagnostics, boolean partial) {}
