/**
 * Shape-directed merging of statistic values.
 */
package org.codeforiati.stats.application.merge;
