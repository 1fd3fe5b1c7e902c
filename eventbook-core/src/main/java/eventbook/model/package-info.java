/**
 * Event and booking types at each stage: raw drafts submitted by callers, normalized
 * payloads produced by the pipelines, and persisted records returned by stores.
 */
package eventbook.model;
