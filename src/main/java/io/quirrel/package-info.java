/**
 * Quirrel source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.quirrel.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.quirrel.client.QuirrelClient} is the embeddable facade: enqueue, list, delete, respond.</li>
 *   <li>{@code io.quirrel.schedule.ScheduleNormalizer} turns enqueue options into one canonical schedule.</li>
 *   <li>{@code io.quirrel.registry.JobRegistry} owns derived names and replace-by-name semantics.</li>
 *   <li>{@code io.quirrel.storage.DurableScheduler} is the boundary to the store that fires jobs.</li>
 *   <li>{@code io.quirrel.delivery.DeliveryResponder} authenticates, decrypts and hands deliveries to user code.</li>
 * </ul>
 */
package io.quirrel;
