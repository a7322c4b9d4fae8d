/**
 * Health probes and the background monitor.
 */
package dbmanager.health;
