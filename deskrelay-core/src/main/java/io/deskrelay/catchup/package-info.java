/**
 * Cursor-based reads of the ticket event log; the recovery path for anything the
 * live hub failed to deliver.
 */
package io.deskrelay.catchup;
