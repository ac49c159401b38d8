package dev.callguard.ser;

public interface Serializer<T> {
    byte[] serialize(T value);
}
