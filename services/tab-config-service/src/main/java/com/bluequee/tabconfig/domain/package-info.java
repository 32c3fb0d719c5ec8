/**
 * Domain layer of the tab configuration service.
 *
 * <ul>
 *   <li>No dependency on Spring, JDBC or the web layer; POJOs wired in {@code config}
 *   <li>{@code port} declares what the domain needs from infrastructure
 *   <li>{@code service} holds the resolution and mutation rules
 *   <li>{@code error} holds the typed failures every mutation can end in
 * </ul>
 */
package com.bluequee.tabconfig.domain;
