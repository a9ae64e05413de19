package com.mountory.db;

import java.util.UUID;

/** Represents a row in the 'location_user_favorite' table. */
public record LocationFavorite(UUID locationId, UUID userId) {}
