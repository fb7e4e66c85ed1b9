/**
 * Provides core classes and interfaces for the retry decorator component.
 * This includes the operation contracts, the progress logger callback and the configuration error type.
 */
package com.sailfish.insistent;
