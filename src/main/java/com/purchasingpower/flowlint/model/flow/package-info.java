/**
 * Documents of an exported conversational agent.
 *
 * <p>One type per document kind found in the export:
 * <ul>
 *   <li>Flow - self-contained segment of conversation, owns its Start page's routes</li>
 *   <li>Page - a state that may fill a form and holds routes and event handlers</li>
 *   <li>RouteGroup - reusable routes shared by pages of one flow</li>
 * </ul>
 *
 * <p>All types are immutable and deserialized by Jackson through their Lombok builders.
 * Unknown fields are ignored; only what the structural analysis needs is mapped.
 *
 * @since 1.0.0
 */
package com.purchasingpower.flowlint.model.flow;
