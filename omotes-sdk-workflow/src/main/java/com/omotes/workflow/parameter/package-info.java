/**
 * Typed workflow parameters: the closed set of variants, their configuration-file parsing,
 * their catalog wire form and the conversion of values to and from wire scalars.
 */
package com.omotes.workflow.parameter;
