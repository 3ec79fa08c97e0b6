/**
 * Jackson codec for inbound series and outbound results.
 */
package com.insightengine.core.json;
