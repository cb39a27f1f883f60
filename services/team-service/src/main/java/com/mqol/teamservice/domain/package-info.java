/**
 * Domain layer: team, membership, invitation and patient models, the domain services that apply
 * the membership rules, and the ports they persist through.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on the {@code api} or {@code infrastructure} packages
 *   <li>Every team-scoped operation receives an {@link com.mqol.access.AccessDecision} or a
 *       {@link com.mqol.access.TeamScope}; tenant ids never come from request payloads
 *   <li>{@code port/} holds the repository interfaces, implemented by JDBC adapters
 * </ul>
 */
package com.mqol.teamservice.domain;
