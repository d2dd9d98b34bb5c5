package com.eainde.planner.visual;

import java.io.Serializable;

/**
 * @param day         day whose calendar post gets a visual concept
 * @param brandColors free text holding up to three hex colours in primary, secondary, accent
 *                    order, e.g. {@code "Primary: #1E40AF, Secondary: #F59E0B"}; null for the default palette
 */
public record VisualConceptRequest(int day, String brandColors) implements Serializable {}
