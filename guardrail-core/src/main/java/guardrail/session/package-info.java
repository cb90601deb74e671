/**
 * Fixed-window sessions that activity cannot extend.
 *
 * @see guardrail.session.SessionManager
 */
package guardrail.session;
