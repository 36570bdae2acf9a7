package com.umitunal.pipeq.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary codec using Kryo.
 *
 * Used for the consolidated seen-ledger document, which holds every subject ever
 * discovered and is rewritten on each discovery run; Kryo keeps it a fraction of
 * its JSON size.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T value) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, value);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new CodecException("Failed to serialize " + type.getName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to deserialize " + type.getName() + " with Kryo", e);
        }
    }

    /**
     * Registration is off so the ledger can evolve without a registration list.
     */
    static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(false);
        return kryo;
    }

    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
