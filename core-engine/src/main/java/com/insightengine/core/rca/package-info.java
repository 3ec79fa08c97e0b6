/**
 * Root-cause analysis: correlation and lead/lag ranking of sibling metrics,
 * causal timeline, and the similar-incident lookup contract.
 */
package com.insightengine.core.rca;
