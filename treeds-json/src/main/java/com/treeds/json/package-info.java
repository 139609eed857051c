/**
 * JSON form of trees (Jackson).
 * <ul>
 *   <li>{@link com.treeds.json.TreeJsonCodec} – toJson / fromJson facade, FULL or COMPACT</li>
 *   <li>{@link com.treeds.json.TreeJsonModule} – serializers and contextual deserializers for any ObjectMapper</li>
 *   <li>{@link com.treeds.json.SerializationMode} – record layout</li>
 * </ul>
 */
package com.treeds.json;
