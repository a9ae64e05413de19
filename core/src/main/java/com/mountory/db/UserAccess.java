package com.mountory.db;

/** A user and the role they hold for a manufacturer. */
public record UserAccess(ManufacturerAccessRole role, User user) {}
