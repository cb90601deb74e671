/**
 * Monotonic one-shot timers shared by every component.
 */
package guardrail.schedule;
