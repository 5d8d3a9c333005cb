/**
 * Outcome types shared by the retry drivers.
 */
package com.sailfish.retry.model;
