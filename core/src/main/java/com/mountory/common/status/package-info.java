/**
 * Status types used instead of exceptions for expected failures.
 *
 * <p>Every DAO method returns either a {@link com.mountory.common.status.Status} or a {@link
 * com.mountory.common.status.StatusOr}. A store failure is reported as {@code INTERNAL} with the
 * original {@link java.sql.SQLException} as its cause, so constraint violations can still be
 * recognised by their SQLSTATE.
 */
package com.mountory.common.status;
