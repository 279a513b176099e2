package com.flamingo.ai.resumescreening.model;

import java.time.Instant;

/** Base metadata shared by every chunk of one resume. */
public record DocumentMetadata(String filename, int pageCount, Instant ingestedAt) {}
