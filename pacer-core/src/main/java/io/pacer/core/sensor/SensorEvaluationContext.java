package io.pacer.core.sensor;

import java.time.Instant;

import com.google.common.base.Optional;
import io.pacer.spi.InstanceFactory;
import io.pacer.spi.InstanceRef;
import io.pacer.spi.SensorInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State a sensor routine can read during one tick.
 *
 * The instance is opened on first access from the instance reference and closed when the
 * context is closed. An instance given directly to the context is owned by the caller and is
 * not closed. A closed context does not give out its instance any more.
 *
 * Contexts of asset sensors carry one cursor tracker of the kind the sensor was built for.
 */
public class SensorEvaluationContext
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(SensorEvaluationContext.class);

    private final Optional<InstanceRef> instanceRef;
    private final Optional<InstanceFactory> instanceFactory;
    private final Optional<Instant> lastCompletionTime;
    private final Optional<String> lastRunKey;
    private final Optional<String> repositoryName;

    private Optional<String> cursor;
    private SensorInstance instance;
    private boolean ownsInstance;
    private boolean closed;
    private Optional<MultiAssetCursorTracker> multiAssetTracker = Optional.absent();
    private Optional<PartitionedAssetCursorTracker> partitionedAssetTracker = Optional.absent();

    private SensorEvaluationContext(Builder builder)
    {
        this.instanceRef = builder.instanceRef;
        this.instanceFactory = builder.instanceFactory;
        this.lastCompletionTime = builder.lastCompletionTime;
        this.lastRunKey = builder.lastRunKey;
        this.repositoryName = builder.repositoryName;
        this.cursor = builder.cursor;
        this.instance = builder.instance.orNull();
        this.ownsInstance = false;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Optional<InstanceRef> getInstanceRef()
    {
        return instanceRef;
    }

    public Optional<Instant> getLastCompletionTime()
    {
        return lastCompletionTime;
    }

    public Optional<String> getLastRunKey()
    {
        return lastRunKey;
    }

    public Optional<String> getRepositoryName()
    {
        return repositoryName;
    }

    public Optional<String> getCursor()
    {
        return cursor;
    }

    /**
     * Replaces the cursor that is returned with the result of this tick.
     */
    public void updateCursor(Optional<String> cursor)
    {
        this.cursor = cursor;
    }

    public synchronized SensorInstance getInstance()
    {
        if (closed) {
            throw new InvariantViolationException("Attempted to use the instance of a closed sensor context.");
        }
        if (instance == null) {
            if (!instanceRef.isPresent() || !instanceFactory.isPresent()) {
                throw new InvariantViolationException(
                        "Attempted to initialize instance, but no instance reference was provided.");
            }
            logger.debug("Opening instance {}", instanceRef.get().getLocation());
            instance = instanceFactory.get().open(instanceRef.get());
            ownsInstance = true;
        }
        return instance;
    }

    public Optional<AssetCursorTracker> getAssetCursorTracker()
    {
        if (multiAssetTracker.isPresent()) {
            return Optional.of(multiAssetTracker.get());
        }
        return Optional.fromNullable(partitionedAssetTracker.orNull());
    }

    public MultiAssetCursorTracker getMultiAssetTracker()
    {
        if (!multiAssetTracker.isPresent()) {
            throw new InvariantViolationException("This context is not built for a multi-asset sensor");
        }
        return multiAssetTracker.get();
    }

    public PartitionedAssetCursorTracker getPartitionedAssetTracker()
    {
        if (!partitionedAssetTracker.isPresent()) {
            throw new InvariantViolationException("This context is not built for a partitioned asset sensor");
        }
        return partitionedAssetTracker.get();
    }

    void attachTracker(MultiAssetCursorTracker tracker)
    {
        checkNoTracker();
        this.multiAssetTracker = Optional.of(tracker);
    }

    void attachTracker(PartitionedAssetCursorTracker tracker)
    {
        checkNoTracker();
        this.partitionedAssetTracker = Optional.of(tracker);
    }

    private void checkNoTracker()
    {
        if (getAssetCursorTracker().isPresent()) {
            throw new InvariantViolationException("This context already has an asset cursor tracker");
        }
    }

    @Override
    public synchronized void close()
    {
        closed = true;
        if (instance != null && ownsInstance) {
            logger.debug("Closing instance {}", instanceRef.get().getLocation());
            instance.close();
            instance = null;
            ownsInstance = false;
        }
    }

    public static class Builder
    {
        private Optional<InstanceRef> instanceRef = Optional.absent();
        private Optional<InstanceFactory> instanceFactory = Optional.absent();
        private Optional<SensorInstance> instance = Optional.absent();
        private Optional<Instant> lastCompletionTime = Optional.absent();
        private Optional<String> lastRunKey = Optional.absent();
        private Optional<String> cursor = Optional.absent();
        private Optional<String> repositoryName = Optional.absent();

        private Builder()
        { }

        public Builder instanceRef(InstanceRef instanceRef, InstanceFactory instanceFactory)
        {
            this.instanceRef = Optional.of(instanceRef);
            this.instanceFactory = Optional.of(instanceFactory);
            return this;
        }

        public Builder instance(Optional<SensorInstance> instance)
        {
            this.instance = instance;
            return this;
        }

        public Builder lastCompletionTime(Optional<Instant> lastCompletionTime)
        {
            this.lastCompletionTime = lastCompletionTime;
            return this;
        }

        public Builder lastRunKey(Optional<String> lastRunKey)
        {
            this.lastRunKey = lastRunKey;
            return this;
        }

        public Builder cursor(Optional<String> cursor)
        {
            this.cursor = cursor;
            return this;
        }

        public Builder repositoryName(Optional<String> repositoryName)
        {
            this.repositoryName = repositoryName;
            return this;
        }

        public SensorEvaluationContext build()
        {
            return new SensorEvaluationContext(this);
        }
    }
}
