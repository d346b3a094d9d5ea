package org.omicsfusion.utils;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.OmicsFusionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

public final class Utils {

    private Utils(){}

    private static final int TEXT_WARNING_WIDTH = 68;
    private static final String TEXT_WARNING_PREFIX = "* ";
    private static final String TEXT_WARNING_BORDER = StringUtils.repeat('*', TEXT_WARNING_PREFIX.length() + TEXT_WARNING_WIDTH);
    private static final char ESCAPE_CHAR = '\u001B';

    /** our log, which we want to capture anything from this class */
    private static final Logger logger = LogManager.getLogger(Utils.class);

    public static void warnUser(final String msg) {
        warnUser(logger, msg);
    }

    public static void warnUser(final Logger logger, final String msg) {
        for (final String line: warnUserLines(msg)) {
            logger.warn(line);
        }
    }

    public static List<String> warnUserLines(final String msg) {
        final List<String> results = new ArrayList<>();
        results.add(TEXT_WARNING_BORDER);
        results.add(TEXT_WARNING_PREFIX + "WARNING:");
        results.add(TEXT_WARNING_PREFIX);
        prettyPrintWarningMessage(results, msg);
        results.add(TEXT_WARNING_BORDER);
        return results;
    }

    /**
     * pretty print the warning message supplied
     *
     * @param results the pretty printed message
     * @param message the message
     */
    private static void prettyPrintWarningMessage(final List<String> results, final String message) {
        for (final String line: message.split("\\r?\\n")) {
            final StringBuilder builder = new StringBuilder(line);
            while (builder.length() > TEXT_WARNING_WIDTH) {
                int space = getLastSpace(builder, TEXT_WARNING_WIDTH);
                if (space <= 0) {
                    space = TEXT_WARNING_WIDTH;
                }
                results.add(String.format("%s%s", TEXT_WARNING_PREFIX, builder.substring(0, space)));
                builder.delete(0, space + 1);
            }
            results.add(String.format("%s%s", TEXT_WARNING_PREFIX, builder));
        }
    }

    /**
     * Returns the last whitespace location in string, before width characters.
     * @param message The message to break.
     * @param width The width of the line.
     * @return The last whitespace location.
     */
    private static int getLastSpace(final CharSequence message, final int width) {
        final int length = message.length();
        int stopPos = width;
        int currPos = 0;
        int lastSpace = -1;
        boolean inEscape = false;
        while (currPos < stopPos && currPos < length) {
            final char c = message.charAt(currPos);
            if (c == ESCAPE_CHAR) {
                stopPos++;
                inEscape = true;
            } else if (inEscape) {
                stopPos++;
                if (Character.isLetter(c)) {
                    inEscape = false;
                }
            } else if (Character.isWhitespace(c)) {
                lastSpace = currPos;
            }
            currPos++;
        }
        return lastSpace;
    }

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link Collection} is not {@code null} and that it is not empty.
     * If it's non-null and non-empty it returns the input, otherwise it throws an {@link IllegalArgumentException}
     * @param collection any Collection
     * @param message a message to include in the output
     * @return the original collection
     * @throws IllegalArgumentException if collection is null or empty
     */
    public static <I, T extends Collection<I>> T nonEmpty(T collection, String message){
        nonNull(collection, "The collection is null: " + message);
        if(collection.isEmpty()){
            throw new IllegalArgumentException("The collection is empty: " + message);
        } else {
            return collection;
        }
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * If it's non-null and non-empty it returns the input, otherwise it throws an {@link IllegalArgumentException}
     * @param string any String
     * @param message a message to include in the output
     * @return the original string
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(String string, String message){
        nonNull(string, "The string is null: " + message);
        if(string.isEmpty()){
            throw new IllegalArgumentException("The string is empty: " + message);
        } else {
            return string;
        }
    }

    /**
     * Checks that the collection does not contain a {@code null} value (throws an {@link IllegalArgumentException} if it does).
     * @param collection collection
     * @param message the text message that would be pass to the exception thrown when c contains a null.
     * @throws IllegalArgumentException if collection is null or contains any null elements
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        Utils.nonNull(collection, message);
        //cannot use Collection.contains(null) here because this throws a NullPointerException when used with many Sets
        if (collection.stream().anyMatch(v -> v == null)){
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks whether an index is within bounds considering a collection or array of a particular size
     * whose first position index is 0
     * @param index the query index.
     * @param length the collection or array size.
     * @return same value as the input {@code index}.
     */
    public static int validIndex(final int index, final int length) {
        if (index < 0) {
            throw new IllegalArgumentException("the index cannot be negative: " + index);
        } else if (index >= length) {
            throw new IllegalArgumentException("the index points past the last element of the collection or array: " + index + " > " + (length -1));
        }
        return index;
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.  If msg is not a
     * String literal i.e. if it requires computation, use the Supplier<String> version, below.
     */
    public static void validate(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalStateException(msg.get());
        }
    }

    /**
     * Like Guava's {@link Iterators#transform(Iterator, com.google.common.base.Function)}, but runs a fixed number
     * ({@code numThreads}) of transformations in parallel, while maintaining ordering of the output iterator.
     * This is useful if the transformations are CPU intensive.
     */
    public static <F, T> Iterator<T> transformParallel(final Iterator<F> fromIterator, final Function<F, T> function, final int numThreads) {
        Utils.nonNull(fromIterator, "fromIterator");
        Utils.nonNull(function, "function");
        Utils.validateArg(numThreads >= 1, "numThreads must be at least 1");

        if (numThreads == 1) { // defer to Guava for single-threaded case
            return Iterators.transform(fromIterator, function::apply);
        }
        // use an executor service for the multi-threaded case
        final ExecutorService executorService = Executors.newFixedThreadPool(numThreads);
        final Queue<Future<T>> futures = new LinkedList<>();
        return new AbstractIterator<T>() {
            @Override
            protected T computeNext() {
                try {
                    while (fromIterator.hasNext()) {
                        if (futures.size() == numThreads) {
                            return futures.remove().get();
                        }
                        final F next = fromIterator.next();
                        final Future<T> future = executorService.submit(() -> function.apply(next));
                        futures.add(future);
                    }
                    if (!futures.isEmpty()) {
                        return futures.remove().get();
                    }
                    executorService.shutdown();
                    return endOfData();
                } catch (final InterruptedException e) {
                    executorService.shutdownNow();
                    Thread.currentThread().interrupt();
                    throw new OmicsFusionException("Interrupted while running task", e);
                } catch (final ExecutionException e) {
                    executorService.shutdownNow();
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new OmicsFusionException("Problem running task", e);
                }
            }
        };
    }

    /** Gets duplicated items in the collection, in order of first repetition. */
    public static <T> Set<T> getDuplicatedItems(final Collection<T> objects) {
        final Set<T> unique = new HashSet<>();
        final Set<T> duplicated = new LinkedHashSet<>();
        for (final T object : objects) {
            if (!unique.add(object)) {
                duplicated.add(object);
            }
        }
        return duplicated;
    }
}
