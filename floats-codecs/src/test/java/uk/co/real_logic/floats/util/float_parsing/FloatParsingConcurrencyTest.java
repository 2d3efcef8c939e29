/*
 * Copyright 2015-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package uk.co.real_logic.floats.util.float_parsing;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FloatParsingConcurrencyTest
{
    private static final int THREADS = 8;
    private static final int INPUTS = 2_000;
    private static final int ROUNDS = 20;

    @Test(timeout = 60_000)
    public void shouldParseConcurrentlyFromStaticFacade() throws Exception
    {
        final String[] inputs = new String[INPUTS];
        final long[] expected = new long[INPUTS];
        final Random random = new Random(7);
        for (int i = 0; i < INPUTS; i++)
        {
            final long mantissa = 1 + (long)(random.nextDouble() * 99_999_999_999_999_998L);
            inputs[i] = mantissa + "e" + (random.nextInt(600) - 320);
            expected[i] = Double.doubleToRawLongBits(Double.parseDouble(inputs[i]));
        }

        final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try
        {
            final List<Future<Integer>> results = new ArrayList<>();
            for (int thread = 0; thread < THREADS; thread++)
            {
                final int start = thread;
                results.add(executor.submit((Callable<Integer>)() ->
                {
                    int parsed = 0;
                    for (int round = 0; round < ROUNDS; round++)
                    {
                        for (int i = start; i < INPUTS; i += 3)
                        {
                            final long actual = Double.doubleToRawLongBits(FloatParsing.parseDouble(inputs[i]));
                            assertEquals(inputs[i], expected[i], actual);
                            parsed++;
                        }
                    }
                    return parsed;
                }));
            }

            for (final Future<Integer> result : results)
            {
                assertTrue(result.get() > 0);
            }
        }
        finally
        {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }
}
