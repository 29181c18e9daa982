/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsight.core.model;

/**
 * Semantic category of a stored memory item. Declaration order is the tie-break priority used by the classifier,
 * most specific first.
 */
public enum MemoryCategory {
    /**
     * Source code, commands, stack traces
     */
    CODE,
    /**
     * Step by step instructions
     */
    PROCEDURE,
    /**
     * Multi stage processes, pipelines
     */
    WORKFLOW,
    /**
     * Things the user needs to do
     */
    TASK,
    /**
     * Links, citations, external resources
     */
    REFERENCE,
    /**
     * Documents, notes, files
     */
    DOCUMENT,
    /**
     * Screenshots, pictures and their captions
     */
    IMAGE,
    /**
     * Recordings and clips
     */
    VIDEO,
    /**
     * Preferences and personal details of the user
     */
    PERSONAL,
    /**
     * Facts and statements about the world or schedule
     */
    FACT,
    /**
     * Definitions and explanations of ideas
     */
    CONCEPT,
    /**
     * Questions asked by the user
     */
    QUESTION,
    GREETING,
    CONVERSATION,
    /**
     * Fallback when nothing else matches
     */
    GENERAL,
}
