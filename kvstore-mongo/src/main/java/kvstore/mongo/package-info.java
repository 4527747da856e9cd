/**
 * MongoDB backend. Values are stored as native BSON under {@code value}.
 */
package kvstore.mongo;
