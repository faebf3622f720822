/**
 * Masking of secret output fields for display.
 */
package com.actguard.masking;
