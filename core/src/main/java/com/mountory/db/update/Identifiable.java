package com.mountory.db.update;

import java.util.UUID;

/** A stored entity that can be referenced by its primary key. */
public interface Identifiable {
  UUID id();
}
