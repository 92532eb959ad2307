/**
 * Disruptor-based packet ingestion feeding the flow table from a single consumer thread.
 */
package fr.lapetina.qos.infrastructure.recognition.ingestion;
