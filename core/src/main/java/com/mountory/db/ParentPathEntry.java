package com.mountory.db;

import java.util.UUID;

/** One ancestor of a location or an activity, named by its name or title. */
public record ParentPathEntry(UUID id, String name) {}
