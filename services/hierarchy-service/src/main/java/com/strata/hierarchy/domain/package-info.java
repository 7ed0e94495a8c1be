/**
 * Hierarchy model: entity kinds and rows, memberships, listing options and the typed failures
 * services raise. No Spring or JDBC types appear here.
 */
package com.strata.hierarchy.domain;
