package com.mountory.db;

import java.util.Collection;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Filter of {@link Manufacturers#query}.
 *
 * <ul>
 *   <li>Without a user only {@code hidden} applies and no role is reported.
 *   <li>With a user and neither {@code hidden} nor roles, the result is every public manufacturer
 *       plus every manufacturer the user has a role for.
 *   <li>With a user and {@code hidden = false}, only public manufacturers are returned.
 *   <li>With a user and {@code hidden = true}, only hidden manufacturers the user has a role for
 *       are returned.
 *   <li>Roles restrict the result to manufacturers for which the user holds one of them. A null
 *       element stands for "no role" and matches public manufacturers without a role.
 * </ul>
 *
 * @param userId the querying user
 * @param hidden the visibility to match
 * @param accessRoles the roles to match, may contain null; null or empty skips the dimension
 */
public record ManufacturerFilter(
    @Nullable UUID userId,
    @Nullable Boolean hidden,
    @Nullable Collection<ManufacturerAccessRole> accessRoles) {

  /** A filter without any restriction. */
  public static ManufacturerFilter all() {
    return new ManufacturerFilter(null, null, null);
  }

  /** The manufacturers visible to a user. */
  public static ManufacturerFilter visibleTo(UUID userId) {
    return new ManufacturerFilter(userId, null, null);
  }
}
